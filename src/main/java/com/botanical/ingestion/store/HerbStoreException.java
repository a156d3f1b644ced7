package com.botanical.ingestion.store;

/**
 * Raised by a {@link HerbStore} when a read or write cannot be completed.
 */
public class HerbStoreException extends RuntimeException {

    public HerbStoreException(String message) {
        super(message);
    }

    public HerbStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

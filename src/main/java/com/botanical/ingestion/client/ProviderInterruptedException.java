package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

/**
 * The calling thread was interrupted while throttling, backing off or awaiting a response.
 * The thread's interrupt flag is restored before this is thrown.
 */
public class ProviderInterruptedException extends ProviderException {

    public ProviderInterruptedException(Provider provider, String message, InterruptedException cause) {
        super(provider, message, cause);
    }
}

package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

/**
 * Base class for every failure raised by a provider client.
 */
public class ProviderException extends RuntimeException {

    private final Provider provider;

    public ProviderException(Provider provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderException(Provider provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public Provider getProvider() {
        return provider;
    }
}

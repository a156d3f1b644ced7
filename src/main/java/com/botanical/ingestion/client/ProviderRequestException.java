package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

/**
 * The request URI could not be built from the configured base URL and endpoint.
 * Raised before any network attempt and never retried.
 */
public class ProviderRequestException extends ProviderException {

    public ProviderRequestException(Provider provider, String message) {
        super(provider, message);
    }
}

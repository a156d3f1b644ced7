package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

/**
 * Connection-level failure: DNS, refused connection, reset, malformed response.
 */
public class ProviderNetworkException extends ProviderException {

    public ProviderNetworkException(Provider provider, String endpoint, Throwable cause) {
        super(provider, "Network error calling " + endpoint + ": " + cause.getMessage(), cause);
    }
}

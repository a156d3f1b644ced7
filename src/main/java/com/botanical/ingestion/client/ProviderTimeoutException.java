package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

import java.time.Duration;

/**
 * A single HTTP attempt did not complete within the configured request timeout.
 */
public class ProviderTimeoutException extends ProviderException {

    private final Duration timeout;

    public ProviderTimeoutException(Provider provider, String endpoint, Duration timeout) {
        super(provider, "Request to " + endpoint + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

import java.time.Instant;

/**
 * Raised without touching the network while a provider's circuit is open.
 */
public class CircuitOpenException extends ProviderException {

    private final int failureCount;
    private final Instant nextRetryAt;

    public CircuitOpenException(Provider provider, int failureCount, Instant nextRetryAt) {
        super(provider, "Circuit breaker is OPEN for " + provider.displayName()
                + " after " + failureCount + " failures. Next retry at " + nextRetryAt);
        this.failureCount = failureCount;
        this.nextRetryAt = nextRetryAt;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }
}

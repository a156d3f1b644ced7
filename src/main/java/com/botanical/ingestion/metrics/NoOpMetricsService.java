package com.botanical.ingestion.metrics;

import com.botanical.ingestion.client.CircuitState;
import com.botanical.ingestion.client.ErrorCategory;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.resolution.MatchType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordProviderRequest(Provider provider, boolean success, Duration duration) {
    }

    @Override
    public void incrementRetry(Provider provider, ErrorCategory category) {
    }

    @Override
    public void recordCircuitTransition(Provider provider, CircuitState from, CircuitState to) {
    }

    @Override
    public void recordCacheHit(Provider provider) {
    }

    @Override
    public void recordCacheMiss(Provider provider) {
    }

    @Override
    public void incrementHerbCreated(Provider provider) {
    }

    @Override
    public void incrementHerbUpdated(Provider provider, MatchType matchType) {
    }

    @Override
    public void recordReconcile(int merged, int deleted, int errors) {
    }
}

package com.botanical.ingestion.metrics;

import com.botanical.ingestion.client.CircuitState;
import com.botanical.ingestion.client.ErrorCategory;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.resolution.MatchType;

import java.time.Duration;

/**
 * Interface for recording ingestion metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordProviderRequest(Provider provider, boolean success, Duration duration);

    void incrementRetry(Provider provider, ErrorCategory category);

    void recordCircuitTransition(Provider provider, CircuitState from, CircuitState to);

    void recordCacheHit(Provider provider);

    void recordCacheMiss(Provider provider);

    void incrementHerbCreated(Provider provider);

    void incrementHerbUpdated(Provider provider, MatchType matchType);

    void recordReconcile(int merged, int deleted, int errors);
}

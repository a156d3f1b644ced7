package com.botanical.ingestion.metrics;

import com.botanical.ingestion.client.CircuitState;
import com.botanical.ingestion.client.CircuitStateListener;
import com.botanical.ingestion.core.model.Provider;

/**
 * Forwards circuit breaker transitions to a {@link MetricsService}.
 */
public class MetricsCircuitStateListener implements CircuitStateListener {

    private final MetricsService metrics;

    public MetricsCircuitStateListener(MetricsService metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onStateChange(Provider provider, CircuitState from, CircuitState to) {
        metrics.recordCircuitTransition(provider, from, to);
    }
}

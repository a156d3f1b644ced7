package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

/**
 * Listener notified after a circuit breaker changes state.
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(Provider provider, CircuitState from, CircuitState to);
}

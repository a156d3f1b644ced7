package com.botanical.ingestion.client;

import java.time.Duration;

/**
 * Configuration for {@link CircuitBreaker}.
 *
 * @param failureThreshold consecutive failures that open the circuit
 * @param cooldown         how long the circuit stays open before a trial call is allowed
 * @param successThreshold consecutive trial successes needed to close the circuit again
 */
public record CircuitBreakerConfig(int failureThreshold, Duration cooldown, int successThreshold) {

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0");
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be > 0");
        }
    }

    /**
     * Default configuration: open after 5 failures, 60s cooldown, close after 2 successes.
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60), 2);
    }
}

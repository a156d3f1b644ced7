package com.botanical.ingestion.health;

/**
 * A single component check, such as one provider client.
 * Implementations report problems through the returned {@link HealthStatus}
 * rather than by throwing.
 */
public interface HealthCheck {

    /**
     * Stable name used as the key in aggregate reports.
     */
    String getName();

    HealthStatus check();
}

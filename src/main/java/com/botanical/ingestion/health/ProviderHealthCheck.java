package com.botanical.ingestion.health;

import com.botanical.ingestion.client.BotanicalProvider;
import com.botanical.ingestion.client.CircuitState;
import com.botanical.ingestion.client.RetryStats;

/**
 * Health check for one provider client, built from its circuit state and
 * request counters. Performs no network call.
 */
public class ProviderHealthCheck implements HealthCheck {

    private final BotanicalProvider provider;

    public ProviderHealthCheck(BotanicalProvider provider) {
        this.provider = provider;
    }

    @Override
    public String getName() {
        return provider.getProvider().key();
    }

    @Override
    public HealthStatus check() {
        String name = provider.getProvider().displayName();
        if (!provider.isConfigured()) {
            return HealthStatus.degraded(name + " API key not configured")
                    .withDetail("configured", false);
        }

        RetryStats stats = provider.getStats();
        CircuitState circuitState = provider.getCircuitState();
        ProviderHealthScore health = ProviderHealthScore.of(stats);

        HealthStatus base;
        if (circuitState == CircuitState.OPEN) {
            base = HealthStatus.down(name + " circuit breaker is open");
        } else if (health.band() == ProviderHealthScore.Band.UNHEALTHY) {
            base = HealthStatus.down(name + " health score " + health.score());
        } else if (circuitState == CircuitState.HALF_OPEN) {
            base = HealthStatus.degraded(name + " circuit breaker is half-open");
        } else if (health.band() == ProviderHealthScore.Band.DEGRADED) {
            base = HealthStatus.degraded(name + " health score " + health.score());
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("configured", true)
                .withDetail("circuitState", circuitState.name())
                .withDetail("healthScore", health.score())
                .withDetail("issues", health.issues())
                .withDetail("totalRequests", stats.totalRequests())
                .withDetail("successRate", Math.round(stats.successRate() * 10.0) / 10.0)
                .withDetail("avgResponseTimeMs", stats.avgResponseTimeMs());
    }
}

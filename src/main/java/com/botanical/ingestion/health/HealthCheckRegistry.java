package com.botanical.ingestion.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of health checks that can be queried for aggregate health.
 *
 * <p>Aggregation logic:</p>
 * <ul>
 *   <li>Any DOWN check: overall status is DOWN</li>
 *   <li>Any DEGRADED check and none DOWN: overall status is DEGRADED</li>
 *   <li>All UP: overall status is UP</li>
 * </ul>
 * A check that throws is reported as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    /**
     * Runs all registered health checks and returns an aggregate status whose
     * details hold one entry per check.
     */
    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> checkResults = new LinkedHashMap<>();
        HealthStatus.Status worstStatus = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            checkResults.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));

            if (result.status().ordinal() > worstStatus.ordinal()) {
                worstStatus = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worstStatus, worstMessage, checkResults);
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.checkFailed name={}", check.getName(), e);
            return HealthStatus.down("Health check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }

    public int size() {
        return checks.size();
    }
}

package com.botanical.ingestion.health;

import com.botanical.ingestion.client.RetryStats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Dashboard score (0 to 100) derived from a provider's request counters,
 * with a human-readable reason for every deduction.
 *
 * <p>Deductions: 20 below 90% success and another 20 below 70%; 15 each for
 * retry rate above 30%, timeout rate above 10% and network-error rate above 5%;
 * 10 for any rate-limit response; 20 for any circuit trip.</p>
 */
public record ProviderHealthScore(int score, Band band, List<String> issues) {

    public static final int HEALTHY_THRESHOLD = 80;
    public static final int DEGRADED_THRESHOLD = 50;

    public enum Band { HEALTHY, DEGRADED, UNHEALTHY }

    public ProviderHealthScore {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static ProviderHealthScore of(RetryStats stats) {
        if (stats.totalRequests() == 0) {
            return new ProviderHealthScore(100, Band.HEALTHY, List.of("No requests made yet"));
        }

        int score = 100;
        List<String> issues = new ArrayList<>();

        double successRate = stats.successRate();
        if (successRate < 90) {
            score -= 20;
            issues.add("Low success rate: " + percent(successRate));
        }
        if (successRate < 70) {
            score -= 20;
            issues.add("Critical: Success rate below 70%");
        }
        if (stats.retryRate() > 30) {
            score -= 15;
            issues.add("High retry rate: " + percent(stats.retryRate()));
        }
        if (stats.timeoutRate() > 10) {
            score -= 15;
            issues.add("High timeout rate: " + percent(stats.timeoutRate()));
        }
        if (stats.networkErrorRate() > 5) {
            score -= 15;
            issues.add("Network issues detected: " + percent(stats.networkErrorRate()));
        }
        if (stats.rateLimitErrors() > 0) {
            score -= 10;
            issues.add("Rate limit errors: " + stats.rateLimitErrors());
        }
        if (stats.circuitBreakerTrips() > 0) {
            score -= 20;
            issues.add("Circuit breaker activated " + stats.circuitBreakerTrips() + " times");
        }

        score = Math.max(0, score);
        return new ProviderHealthScore(score, bandOf(score), issues);
    }

    /**
     * Scores the sum of several providers' counters, as the overall dashboard does.
     */
    public static ProviderHealthScore combined(Collection<RetryStats> all) {
        return of(sum(all));
    }

    static RetryStats sum(Collection<RetryStats> all) {
        long total = 0, success = 0, failed = 0, retried = 0, retries = 0;
        long timeouts = 0, network = 0, rateLimits = 0, trips = 0, weightedLatency = 0;
        for (RetryStats s : all) {
            total += s.totalRequests();
            success += s.successfulRequests();
            failed += s.failedRequests();
            retried += s.retriedRequests();
            retries += s.totalRetries();
            timeouts += s.timeoutErrors();
            network += s.networkErrors();
            rateLimits += s.rateLimitErrors();
            trips += s.circuitBreakerTrips();
            weightedLatency += s.avgResponseTimeMs() * s.successfulRequests();
        }
        long avg = success == 0 ? 0 : Math.round((double) weightedLatency / success);
        return new RetryStats(total, success, failed, retried, retries, timeouts, network, rateLimits, trips, avg);
    }

    static Band bandOf(int score) {
        if (score >= HEALTHY_THRESHOLD) {
            return Band.HEALTHY;
        }
        return score >= DEGRADED_THRESHOLD ? Band.DEGRADED : Band.UNHEALTHY;
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }
}

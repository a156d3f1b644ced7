package com.botanical.ingestion.client;

/**
 * Immutable snapshot of a client's request counters.
 *
 * @param totalRequests       calls that passed the configuration check
 * @param successfulRequests  calls that eventually succeeded
 * @param failedRequests      calls that eventually failed
 * @param retriedRequests     calls that needed at least one retry
 * @param totalRetries        retry attempts across all calls
 * @param timeoutErrors       attempts that timed out
 * @param networkErrors       attempts that failed at the connection level
 * @param rateLimitErrors     attempts answered with HTTP 429
 * @param circuitBreakerTrips calls rejected by an open circuit
 * @param avgResponseTimeMs   rounded mean latency of successful calls
 */
public record RetryStats(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long retriedRequests,
        long totalRetries,
        long timeoutErrors,
        long networkErrors,
        long rateLimitErrors,
        long circuitBreakerTrips,
        long avgResponseTimeMs
) {

    public static RetryStats empty() {
        return new RetryStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Percentage of calls that succeeded, 100 when nothing has been requested yet.
     */
    public double successRate() {
        return percentOfRequests(successfulRequests, 100.0);
    }

    public double retryRate() {
        return percentOfRequests(retriedRequests, 0.0);
    }

    public double timeoutRate() {
        return percentOfRequests(timeoutErrors, 0.0);
    }

    public double networkErrorRate() {
        return percentOfRequests(networkErrors, 0.0);
    }

    private double percentOfRequests(long count, double whenEmpty) {
        return totalRequests == 0 ? whenEmpty : (count * 100.0) / totalRequests;
    }
}

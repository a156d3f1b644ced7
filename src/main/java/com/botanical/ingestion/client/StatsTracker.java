package com.botanical.ingestion.client;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe request counters for one provider client.
 * Counters only grow; {@link #reset()} is the only way back to zero.
 */
public class StatsTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong retriedRequests = new AtomicLong();
    private final AtomicLong totalRetries = new AtomicLong();
    private final AtomicLong timeoutErrors = new AtomicLong();
    private final AtomicLong networkErrors = new AtomicLong();
    private final AtomicLong rateLimitErrors = new AtomicLong();
    private final AtomicLong circuitBreakerTrips = new AtomicLong();
    private final AtomicLong responseTimeSumMs = new AtomicLong();
    private final AtomicLong responseTimeCount = new AtomicLong();

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordSuccess(Duration responseTime) {
        successfulRequests.incrementAndGet();
        responseTimeSumMs.addAndGet(responseTime.toMillis());
        responseTimeCount.incrementAndGet();
    }

    public void recordFailure() {
        failedRequests.incrementAndGet();
    }

    /**
     * Records one retry attempt.
     *
     * @param firstRetryOfCall true for the first retry of a call, which also counts the call as retried
     */
    public void recordRetry(boolean firstRetryOfCall) {
        totalRetries.incrementAndGet();
        if (firstRetryOfCall) {
            retriedRequests.incrementAndGet();
        }
    }

    public void recordTimeout() {
        timeoutErrors.incrementAndGet();
    }

    public void recordNetworkError() {
        networkErrors.incrementAndGet();
    }

    public void recordRateLimit() {
        rateLimitErrors.incrementAndGet();
    }

    public void recordCircuitBreakerTrip() {
        circuitBreakerTrips.incrementAndGet();
    }

    public RetryStats getStats() {
        long count = responseTimeCount.get();
        long avg = count == 0 ? 0 : Math.round((double) responseTimeSumMs.get() / count);
        return new RetryStats(
                totalRequests.get(),
                successfulRequests.get(),
                failedRequests.get(),
                retriedRequests.get(),
                totalRetries.get(),
                timeoutErrors.get(),
                networkErrors.get(),
                rateLimitErrors.get(),
                circuitBreakerTrips.get(),
                avg
        );
    }

    public void reset() {
        totalRequests.set(0);
        successfulRequests.set(0);
        failedRequests.set(0);
        retriedRequests.set(0);
        totalRetries.set(0);
        timeoutErrors.set(0);
        networkErrors.set(0);
        rateLimitErrors.set(0);
        circuitBreakerTrips.set(0);
        responseTimeSumMs.set(0);
        responseTimeCount.set(0);
    }
}

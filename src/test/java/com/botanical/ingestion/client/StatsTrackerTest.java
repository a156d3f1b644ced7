package com.botanical.ingestion.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatsTracker")
class StatsTrackerTest {

    private final StatsTracker tracker = new StatsTracker();

    @Test
    @DisplayName("Empty tracker reports zeros and a 100% success rate")
    void empty() {
        RetryStats stats = tracker.getStats();
        assertEquals(RetryStats.empty(), stats);
        assertEquals(100.0, stats.successRate());
        assertEquals(0.0, stats.retryRate());
    }

    @Test
    @DisplayName("Average response time is the rounded mean of successes")
    void averageResponseTime() {
        tracker.recordRequest();
        tracker.recordSuccess(Duration.ofMillis(100));
        tracker.recordRequest();
        tracker.recordSuccess(Duration.ofMillis(201));

        assertEquals(151, tracker.getStats().avgResponseTimeMs());
    }

    @Test
    @DisplayName("retriedRequests counts calls, totalRetries counts attempts")
    void retryCounting() {
        tracker.recordRetry(true);
        tracker.recordRetry(false);
        tracker.recordRetry(false);
        tracker.recordRetry(true);

        RetryStats stats = tracker.getStats();
        assertEquals(2, stats.retriedRequests());
        assertEquals(4, stats.totalRetries());
    }

    @Test
    @DisplayName("Rates are percentages of total requests")
    void rates() {
        for (int i = 0; i < 4; i++) {
            tracker.recordRequest();
        }
        tracker.recordSuccess(Duration.ofMillis(10));
        tracker.recordSuccess(Duration.ofMillis(10));
        tracker.recordSuccess(Duration.ofMillis(10));
        tracker.recordFailure();
        tracker.recordTimeout();
        tracker.recordRetry(true);

        RetryStats stats = tracker.getStats();
        assertEquals(75.0, stats.successRate());
        assertEquals(25.0, stats.timeoutRate());
        assertEquals(25.0, stats.retryRate());
        assertEquals(0.0, stats.networkErrorRate());
    }

    @Test
    @DisplayName("reset() zeroes every counter")
    void reset() {
        tracker.recordRequest();
        tracker.recordSuccess(Duration.ofMillis(5));
        tracker.recordNetworkError();
        tracker.recordRateLimit();
        tracker.recordCircuitBreakerTrip();

        tracker.reset();

        assertEquals(RetryStats.empty(), tracker.getStats());
    }
}

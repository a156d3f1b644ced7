package com.botanical.ingestion.client;

import java.time.Duration;

/**
 * Configuration for {@link RetryExecutor}.
 *
 * @param maxRetries retries after the first attempt; a call makes at most {@code maxRetries + 1} attempts
 * @param baseDelay  backoff for retry {@code n} is {@code baseDelay * 2^n} plus jitter
 * @param maxJitter  upper bound (exclusive) of the random jitter added to each backoff
 */
public record RetryConfig(int maxRetries, Duration baseDelay, Duration maxJitter) {

    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxJitter == null || maxJitter.isNegative()) {
            throw new IllegalArgumentException("maxJitter must be >= 0");
        }
    }

    /**
     * Default configuration: 3 retries, 1s base delay, up to 1s jitter.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    /**
     * No retries at all.
     */
    public static RetryConfig none() {
        return new RetryConfig(0, Duration.ZERO, Duration.ZERO);
    }
}

package com.botanical.ingestion.client;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of classifying a failed call.
 *
 * @param retryable whether another attempt may succeed
 * @param category  the failure category
 * @param waitHint  mandatory wait before the next attempt, overriding backoff; may be {@code null}
 */
public record ErrorClassification(boolean retryable, ErrorCategory category, Duration waitHint) {

    public static ErrorClassification retryable(ErrorCategory category) {
        return new ErrorClassification(true, category, null);
    }

    public static ErrorClassification retryableAfter(ErrorCategory category, Duration wait) {
        return new ErrorClassification(true, category, wait);
    }

    public static ErrorClassification fatal(ErrorCategory category) {
        return new ErrorClassification(false, category, null);
    }

    public Optional<Duration> getWaitHint() {
        return Optional.ofNullable(waitHint);
    }
}

package com.botanical.ingestion.client;

import java.time.Duration;

/**
 * Blocking pause used by the rate limiter and retry backoff.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}

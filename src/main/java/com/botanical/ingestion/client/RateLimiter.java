package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum spacing between consecutive outbound requests to one provider.
 *
 * <p>The wait is computed and the baseline updated while holding a fair lock,
 * so concurrent callers are released one at a time, in arrival order, each at
 * least {@code minDelay} after the previous one.</p>
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final long NEVER = Long.MIN_VALUE;

    private final Provider provider;
    private final Duration minDelay;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock(true);
    private long lastRequestAtMs = NEVER;

    public RateLimiter(Provider provider, Duration minDelay) {
        this(provider, minDelay, Clock.systemUTC(), Sleeper.system());
    }

    public RateLimiter(Provider provider, Duration minDelay, Clock clock, Sleeper sleeper) {
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must be >= 0");
        }
        this.provider = provider;
        this.minDelay = minDelay;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until at least {@code minDelay} has passed since the previous call returned.
     *
     * @throws ProviderInterruptedException if interrupted while waiting
     */
    public void throttle() {
        lock.lock();
        try {
            if (lastRequestAtMs != NEVER) {
                long waitMs = lastRequestAtMs + minDelay.toMillis() - clock.millis();
                if (waitMs > 0) {
                    log.debug("rateLimiter.throttling provider={} waitMs={}", provider.key(), waitMs);
                    sleeper.sleep(Duration.ofMillis(waitMs));
                }
            }
            lastRequestAtMs = clock.millis();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderInterruptedException(provider, "Interrupted while rate limiting", e);
        } finally {
            lock.unlock();
        }
    }

    public Duration getMinDelay() {
        return minDelay;
    }
}

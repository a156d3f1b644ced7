package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateLimiter")
class RateLimiterTest {

    private final MutableClock clock = new MutableClock();
    private final List<Duration> sleeps = new ArrayList<>();

    private RateLimiter limiter(Duration minDelay) {
        return new RateLimiter(Provider.TREFLE, minDelay, clock, duration -> {
            sleeps.add(duration);
            clock.advance(duration);
        });
    }

    @Test
    @DisplayName("First request is never delayed")
    void firstRequestImmediate() {
        limiter(Duration.ofMillis(500)).throttle();
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Back-to-back requests wait out the remaining spacing")
    void backToBackWaits() {
        RateLimiter limiter = limiter(Duration.ofMillis(500));
        limiter.throttle();
        clock.advance(Duration.ofMillis(200));
        limiter.throttle();

        assertEquals(List.of(Duration.ofMillis(300)), sleeps);
    }

    @Test
    @DisplayName("No wait once the spacing has already elapsed")
    void noWaitAfterSpacing() {
        RateLimiter limiter = limiter(Duration.ofMillis(500));
        limiter.throttle();
        clock.advance(Duration.ofMillis(750));
        limiter.throttle();

        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Consecutive calls are each spaced from the previous one")
    void spacingAccumulates() {
        RateLimiter limiter = limiter(Duration.ofSeconds(1));
        long start = clock.millis();
        limiter.throttle();
        limiter.throttle();
        limiter.throttle();

        assertEquals(2000, clock.millis() - start);
        assertEquals(2, sleeps.size());
    }

    @Test
    @DisplayName("Interrupted wait raises ProviderInterruptedException and keeps the interrupt flag")
    void interruptedWait() {
        RateLimiter limiter = new RateLimiter(Provider.PERENUAL, Duration.ofSeconds(1), clock, d -> {
            throw new InterruptedException("stop");
        });
        limiter.throttle();

        ProviderInterruptedException e = assertThrows(ProviderInterruptedException.class, limiter::throttle);
        assertEquals(Provider.PERENUAL, e.getProvider());
        assertTrue(Thread.interrupted());
    }

    @Test
    @DisplayName("Negative spacing is rejected")
    void negativeSpacingRejected() {
        assertThrows(IllegalArgumentException.class, () -> limiter(Duration.ofMillis(-1)));
    }
}

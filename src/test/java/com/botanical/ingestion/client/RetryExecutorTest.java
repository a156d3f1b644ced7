package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("RetryExecutor")
class RetryExecutorTest {

    private StatsTracker stats;
    private List<Duration> sleeps;
    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        stats = new StatsTracker();
        sleeps = new ArrayList<>();
        metrics = mock(MetricsService.class);
    }

    private RetryExecutor executor(RetryConfig config) {
        return new RetryExecutor(Provider.TREFLE, config, new ErrorClassifier(Duration.ofSeconds(7)),
                stats, sleeps::add, metrics);
    }

    private static ProviderApiException serverError() {
        return new ProviderApiException(Provider.TREFLE, 503, "unavailable");
    }

    @Test
    @DisplayName("Success on the first attempt does not retry")
    void firstAttemptSuccess() {
        assertEquals("ok", executor(RetryConfig.defaults()).runWithRetry(() -> "ok"));
        assertTrue(sleeps.isEmpty());
        assertEquals(0, stats.getStats().totalRetries());
    }

    @Test
    @DisplayName("Retries a transient failure until it succeeds")
    void retriesUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        String result = executor(new RetryConfig(3, Duration.ofMillis(100), Duration.ZERO)).runWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw serverError();
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
        assertEquals(1, stats.getStats().retriedRequests());
        assertEquals(2, stats.getStats().totalRetries());
        verify(metrics, times(2)).incrementRetry(Provider.TREFLE, ErrorCategory.SERVER_ERROR);
    }

    @Test
    @DisplayName("Gives up after maxRetries + 1 attempts and rethrows the last failure")
    void exhaustsRetries() {
        AtomicInteger calls = new AtomicInteger();
        ProviderApiException last = serverError();

        ProviderApiException thrown = assertThrows(ProviderApiException.class,
                () -> executor(new RetryConfig(3, Duration.ZERO, Duration.ZERO)).runWithRetry(() -> {
                    calls.incrementAndGet();
                    throw last;
                }));

        assertSame(last, thrown);
        assertEquals(4, calls.get());
        assertEquals(3, sleeps.size());
    }

    @Test
    @DisplayName("Non-retryable failures are rethrown immediately")
    void fatalNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(ProviderApiException.class,
                () -> executor(RetryConfig.defaults()).runWithRetry(() -> {
                    calls.incrementAndGet();
                    throw new ProviderApiException(Provider.TREFLE, 404, "missing");
                }));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Rate-limit wait hint replaces the exponential backoff")
    void rateLimitWaitHint() {
        AtomicInteger calls = new AtomicInteger();
        executor(new RetryConfig(2, Duration.ofMillis(1), Duration.ZERO)).runWithRetry(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new ProviderApiException(Provider.TREFLE, 429, "slow");
            }
            return "ok";
        });

        assertEquals(List.of(Duration.ofSeconds(7)), sleeps);
    }

    @Test
    @DisplayName("RetryConfig.none() makes a single attempt")
    void noRetries() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(ProviderApiException.class, () -> executor(RetryConfig.none()).runWithRetry(() -> {
            calls.incrementAndGet();
            throw serverError();
        }));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Backoff doubles per attempt and adds bounded jitter")
    void backoffGrowth() {
        RetryExecutor executor = executor(new RetryConfig(3, Duration.ofSeconds(1), Duration.ofMillis(500)));

        for (int attempt = 0; attempt < 3; attempt++) {
            long base = 1000L << attempt;
            long delay = executor.backoff(attempt).toMillis();
            assertTrue(delay >= base && delay < base + 500, "attempt " + attempt + " delay " + delay);
        }
    }

    @Test
    @DisplayName("Interrupted backoff raises ProviderInterruptedException")
    void interruptedBackoff() {
        RetryExecutor executor = new RetryExecutor(Provider.TREFLE, RetryConfig.defaults(), new ErrorClassifier(),
                stats, d -> {
                    throw new InterruptedException();
                }, metrics);

        assertThrows(ProviderInterruptedException.class, () -> executor.runWithRetry(() -> {
            throw serverError();
        }));
        assertTrue(Thread.interrupted());
    }
}

package com.botanical.ingestion.metrics;

import com.botanical.ingestion.client.CircuitBreaker;
import com.botanical.ingestion.client.CircuitBreakerConfig;
import com.botanical.ingestion.client.CircuitState;
import com.botanical.ingestion.client.ErrorCategory;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.resolution.MatchType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods are callable without error")
        void allMethodsCallable() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordProviderRequest(Provider.TREFLE, true, Duration.ofMillis(100));
                noOp.incrementRetry(Provider.TREFLE, ErrorCategory.SERVER_ERROR);
                noOp.recordCircuitTransition(Provider.PERENUAL, CircuitState.CLOSED, CircuitState.OPEN);
                noOp.recordCacheHit(Provider.TREFLE);
                noOp.recordCacheMiss(Provider.PERENUAL);
                noOp.incrementHerbCreated(Provider.TREFLE);
                noOp.incrementHerbUpdated(Provider.PERENUAL, MatchType.SOURCE_ID);
                noOp.recordReconcile(1, 1, 0);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Provider requests are timed per outcome")
        void providerRequests() {
            metrics.recordProviderRequest(Provider.TREFLE, true, Duration.ofMillis(150));
            metrics.recordProviderRequest(Provider.TREFLE, true, Duration.ofMillis(250));
            metrics.recordProviderRequest(Provider.TREFLE, false, Duration.ofMillis(50));

            Timer success = registry.find("botanical.provider.request.duration")
                    .tag("provider", "trefle")
                    .tag("outcome", "success")
                    .timer();
            Timer failure = registry.find("botanical.provider.request.duration")
                    .tag("outcome", "failure")
                    .timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertNotNull(failure);
            assertEquals(1, failure.count());
        }

        @Test
        @DisplayName("Retries are counted per error category")
        void retries() {
            metrics.incrementRetry(Provider.PERENUAL, ErrorCategory.RATE_LIMIT);
            metrics.incrementRetry(Provider.PERENUAL, ErrorCategory.RATE_LIMIT);
            metrics.incrementRetry(Provider.PERENUAL, ErrorCategory.TIMEOUT);

            Counter rateLimit = registry.find("botanical.provider.retry")
                    .tag("provider", "perenual")
                    .tag("category", "RATE_LIMIT")
                    .counter();

            assertNotNull(rateLimit);
            assertEquals(2.0, rateLimit.count());
        }

        @Test
        @DisplayName("Cache hits and misses are counted per provider")
        void cache() {
            metrics.recordCacheHit(Provider.TREFLE);
            metrics.recordCacheMiss(Provider.TREFLE);
            metrics.recordCacheMiss(Provider.TREFLE);

            assertEquals(1.0, registry.find("botanical.provider.cache.hit").counter().count());
            assertEquals(2.0, registry.find("botanical.provider.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Herb creations and updates are counted")
        void herbs() {
            metrics.incrementHerbCreated(Provider.TREFLE);
            metrics.incrementHerbUpdated(Provider.PERENUAL, MatchType.SCIENTIFIC_NAME);

            assertEquals(1.0, registry.find("botanical.herb.created").tag("provider", "trefle").counter().count());
            assertEquals(1.0, registry.find("botanical.herb.updated")
                    .tag("matchType", "SCIENTIFIC_NAME").counter().count());
        }

        @Test
        @DisplayName("Reconcile counters accumulate across runs")
        void reconcile() {
            metrics.recordReconcile(3, 2, 1);
            metrics.recordReconcile(1, 1, 0);

            assertEquals(4.0, registry.find("botanical.reconcile.merged").counter().count());
            assertEquals(3.0, registry.find("botanical.reconcile.deleted").counter().count());
            assertEquals(1.0, registry.find("botanical.reconcile.errors").counter().count());
        }

        @Test
        @DisplayName("Circuit transitions are forwarded by the listener")
        void circuitTransitions() {
            CircuitBreaker breaker = new CircuitBreaker(Provider.TREFLE,
                    new CircuitBreakerConfig(1, Duration.ofMinutes(1), 1), Clock.systemUTC());
            breaker.addListener(new MetricsCircuitStateListener(metrics));

            assertThrows(IllegalStateException.class, () -> breaker.execute(() -> {
                throw new IllegalStateException("down");
            }));

            Counter opened = registry.find("botanical.provider.circuit.transition")
                    .tag("from", "CLOSED")
                    .tag("to", "OPEN")
                    .counter();
            assertNotNull(opened);
            assertEquals(1.0, opened.count());
        }
    }
}

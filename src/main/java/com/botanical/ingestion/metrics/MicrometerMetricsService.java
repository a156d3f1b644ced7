package com.botanical.ingestion.metrics;

import com.botanical.ingestion.client.CircuitState;
import com.botanical.ingestion.client.ErrorCategory;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.resolution.MatchType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code botanical.provider.request.duration}: Timer (tags: provider, outcome)</li>
 *   <li>{@code botanical.provider.retry}: Counter (tags: provider, category)</li>
 *   <li>{@code botanical.provider.circuit.transition}: Counter (tags: provider, from, to)</li>
 *   <li>{@code botanical.provider.cache.hit}: Counter (tag: provider)</li>
 *   <li>{@code botanical.provider.cache.miss}: Counter (tag: provider)</li>
 *   <li>{@code botanical.herb.created}: Counter (tag: provider)</li>
 *   <li>{@code botanical.herb.updated}: Counter (tags: provider, matchType)</li>
 *   <li>{@code botanical.reconcile.merged}, {@code .deleted}, {@code .errors}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter reconcileMergedCounter;
    private final Counter reconcileDeletedCounter;
    private final Counter reconcileErrorCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.reconcileMergedCounter = Counter.builder("botanical.reconcile.merged")
                .description("Duplicate herb records folded into a primary during reconciliation")
                .register(registry);
        this.reconcileDeletedCounter = Counter.builder("botanical.reconcile.deleted")
                .description("Duplicate herb records deleted during reconciliation")
                .register(registry);
        this.reconcileErrorCounter = Counter.builder("botanical.reconcile.errors")
                .description("Duplicate groups that failed to reconcile")
                .register(registry);
    }

    @Override
    public void recordProviderRequest(Provider provider, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(provider.key() + ":" + outcome, k ->
                Timer.builder("botanical.provider.request.duration")
                        .description("Duration of provider calls including retries")
                        .tag("provider", provider.key())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRetry(Provider provider, ErrorCategory category) {
        counter("retry:" + provider.key() + ":" + category.name(), () ->
                Counter.builder("botanical.provider.retry")
                        .description("Retry attempts against a provider")
                        .tag("provider", provider.key())
                        .tag("category", category.name())
                        .register(registry)).increment();
    }

    @Override
    public void recordCircuitTransition(Provider provider, CircuitState from, CircuitState to) {
        counter("circuit:" + provider.key() + ":" + from.name() + ":" + to.name(), () ->
                Counter.builder("botanical.provider.circuit.transition")
                        .description("Circuit breaker state transitions")
                        .tag("provider", provider.key())
                        .tag("from", from.name())
                        .tag("to", to.name())
                        .register(registry)).increment();
    }

    @Override
    public void recordCacheHit(Provider provider) {
        counter("cache.hit:" + provider.key(), () ->
                Counter.builder("botanical.provider.cache.hit")
                        .description("Provider responses served from cache")
                        .tag("provider", provider.key())
                        .register(registry)).increment();
    }

    @Override
    public void recordCacheMiss(Provider provider) {
        counter("cache.miss:" + provider.key(), () ->
                Counter.builder("botanical.provider.cache.miss")
                        .description("Provider responses fetched because the cache had none")
                        .tag("provider", provider.key())
                        .register(registry)).increment();
    }

    @Override
    public void incrementHerbCreated(Provider provider) {
        counter("created:" + provider.key(), () ->
                Counter.builder("botanical.herb.created")
                        .description("New draft herb records created by ingestion")
                        .tag("provider", provider.key())
                        .register(registry)).increment();
    }

    @Override
    public void incrementHerbUpdated(Provider provider, MatchType matchType) {
        counter("updated:" + provider.key() + ":" + matchType.name(), () ->
                Counter.builder("botanical.herb.updated")
                        .description("Existing herb records merged with incoming provider data")
                        .tag("provider", provider.key())
                        .tag("matchType", matchType.name())
                        .register(registry)).increment();
    }

    @Override
    public void recordReconcile(int merged, int deleted, int errors) {
        reconcileMergedCounter.increment(merged);
        reconcileDeletedCounter.increment(deleted);
        reconcileErrorCounter.increment(errors);
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}

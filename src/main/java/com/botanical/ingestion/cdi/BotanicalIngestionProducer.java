package com.botanical.ingestion.cdi;

import com.botanical.ingestion.cache.CacheConfig;
import com.botanical.ingestion.cache.CaffeineResponseCache;
import com.botanical.ingestion.cache.NoOpResponseCache;
import com.botanical.ingestion.cache.ResponseCache;
import com.botanical.ingestion.client.CircuitBreakerConfig;
import com.botanical.ingestion.client.RetryConfig;
import com.botanical.ingestion.dedup.DeduplicationConfig;
import com.botanical.ingestion.dedup.HerbDeduplicationService;
import com.botanical.ingestion.health.HealthCheckRegistry;
import com.botanical.ingestion.health.ProviderHealthCheck;
import com.botanical.ingestion.lock.DistributedLock;
import com.botanical.ingestion.lock.LocalDistributedLock;
import com.botanical.ingestion.lock.LockConfig;
import com.botanical.ingestion.lock.NoOpDistributedLock;
import com.botanical.ingestion.perenual.PerenualClient;
import com.botanical.ingestion.store.HerbStore;
import com.botanical.ingestion.tracing.NoOpTracingService;
import com.botanical.ingestion.tracing.OpenTelemetryTracingService;
import com.botanical.ingestion.tracing.TracingService;
import com.botanical.ingestion.trefle.TrefleClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the provider clients and the deduplication service
 * from MicroProfile Config properties.
 *
 * <p>The application supplies the {@link HerbStore} bean; everything else is
 * produced here. Without API keys the clients are still produced, and report
 * themselves as unconfigured.</p>
 *
 * <pre>
 * botanical:
 *   trefle:
 *     api-key: ${TREFLE_API_KEY}
 *   perenual:
 *     api-key: ${PERENUAL_API_KEY}
 *   lock:
 *     enabled: true
 *     timeout-ms: 30000
 *   tracing:
 *     enabled: false
 * </pre>
 *
 * <p>With tracing enabled the spans go to the globally registered OpenTelemetry
 * SDK, so {@code opentelemetry-api} must then be on the classpath.</p>
 */
@ApplicationScoped
public class BotanicalIngestionProducer {

    private static final Logger log = LoggerFactory.getLogger(BotanicalIngestionProducer.class);

    // ── Trefle ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "botanical.trefle.api-key")
    Optional<String> trefleApiKey;

    @Inject
    @ConfigProperty(name = "botanical.trefle.base-url", defaultValue = TrefleClient.DEFAULT_BASE_URL)
    String trefleBaseUrl;

    @Inject
    @ConfigProperty(name = "botanical.trefle.min-request-spacing-ms", defaultValue = "500")
    long trefleSpacingMs;

    // ── Perenual ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "botanical.perenual.api-key")
    Optional<String> perenualApiKey;

    @Inject
    @ConfigProperty(name = "botanical.perenual.base-url", defaultValue = PerenualClient.DEFAULT_BASE_URL)
    String perenualBaseUrl;

    @Inject
    @ConfigProperty(name = "botanical.perenual.min-request-spacing-ms", defaultValue = "1000")
    long perenualSpacingMs;

    // ── Resilience ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "botanical.request.timeout-seconds", defaultValue = "10")
    int requestTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "botanical.retry.max-retries", defaultValue = "3")
    int maxRetries;

    @Inject
    @ConfigProperty(name = "botanical.retry.base-delay-ms", defaultValue = "1000")
    long retryBaseDelayMs;

    @Inject
    @ConfigProperty(name = "botanical.retry.max-jitter-ms", defaultValue = "1000")
    long retryMaxJitterMs;

    @Inject
    @ConfigProperty(name = "botanical.circuit-breaker.failure-threshold", defaultValue = "5")
    int failureThreshold;

    @Inject
    @ConfigProperty(name = "botanical.circuit-breaker.cooldown-seconds", defaultValue = "60")
    int cooldownSeconds;

    @Inject
    @ConfigProperty(name = "botanical.circuit-breaker.success-threshold", defaultValue = "2")
    int successThreshold;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "botanical.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "botanical.cache.max-size", defaultValue = "5000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "botanical.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ── Tracing ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "botanical.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    // ── Deduplication ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "botanical.lock.enabled", defaultValue = "true")
    boolean lockEnabled;

    @Inject
    @ConfigProperty(name = "botanical.lock.timeout-ms", defaultValue = "30000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "botanical.dedup.scan-page-size", defaultValue = "1000")
    int scanPageSize;

    @Inject
    @ConfigProperty(name = "botanical.dedup.corpus-limit", defaultValue = "10000")
    int corpusLimit;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ResponseCache responseCache() {
        if (!cacheEnabled) {
            log.info("Provider response cache disabled");
            return new NoOpResponseCache();
        }
        log.info("Provider response cache: maxSize={} ttlSeconds={}", cacheMaxSize, cacheTtlSeconds);
        return new CaffeineResponseCache(new CacheConfig(cacheMaxSize, cacheTtlSeconds, true));
    }

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        if (!tracingEnabled) {
            return new NoOpTracingService();
        }
        log.info("Tracing enabled: instrumentation={}", OpenTelemetryTracingService.INSTRUMENTATION_NAME);
        return OpenTelemetryTracingService.fromGlobal();
    }

    @Produces
    @ApplicationScoped
    public TrefleClient trefleClient(ResponseCache cache, TracingService tracing) {
        TrefleClient client = TrefleClient.builder()
                .baseUrl(trefleBaseUrl)
                .apiKey(trefleApiKey.orElse(null))
                .minRequestSpacing(Duration.ofMillis(trefleSpacingMs))
                .requestTimeout(Duration.ofSeconds(requestTimeoutSeconds))
                .retryConfig(retryConfig())
                .circuitBreakerConfig(circuitBreakerConfig())
                .cache(cache)
                .tracing(tracing)
                .build();
        log.info("Producing TrefleClient: baseUrl={} configured={}", trefleBaseUrl, client.isConfigured());
        return client;
    }

    @Produces
    @ApplicationScoped
    public PerenualClient perenualClient(ResponseCache cache, TracingService tracing) {
        PerenualClient client = PerenualClient.builder()
                .baseUrl(perenualBaseUrl)
                .apiKey(perenualApiKey.orElse(null))
                .minRequestSpacing(Duration.ofMillis(perenualSpacingMs))
                .requestTimeout(Duration.ofSeconds(requestTimeoutSeconds))
                .retryConfig(retryConfig())
                .circuitBreakerConfig(circuitBreakerConfig())
                .cache(cache)
                .tracing(tracing)
                .build();
        log.info("Producing PerenualClient: baseUrl={} configured={}", perenualBaseUrl, client.isConfigured());
        return client;
    }

    @Produces
    @ApplicationScoped
    public DistributedLock distributedLock() {
        if (!lockEnabled) {
            log.warn("Ingestion lock disabled: concurrent ingest and reconcile runs are not serialized");
            return new NoOpDistributedLock();
        }
        return new LocalDistributedLock(new LockConfig(lockTimeoutMs));
    }

    @Produces
    @ApplicationScoped
    public HerbDeduplicationService herbDeduplicationService(HerbStore store, DistributedLock lock,
                                                             TracingService tracing) {
        log.info("Producing HerbDeduplicationService: scanPageSize={} corpusLimit={}", scanPageSize, corpusLimit);
        return HerbDeduplicationService.builder()
                .store(store)
                .distributedLock(lock)
                .tracingService(tracing)
                .config(new DeduplicationConfig(scanPageSize, corpusLimit, DeduplicationConfig.defaults().lockKey()))
                .build();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(TrefleClient trefle, PerenualClient perenual) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new ProviderHealthCheck(trefle));
        registry.register(new ProviderHealthCheck(perenual));
        return registry;
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    RetryConfig retryConfig() {
        return new RetryConfig(maxRetries, Duration.ofMillis(retryBaseDelayMs), Duration.ofMillis(retryMaxJitterMs));
    }

    CircuitBreakerConfig circuitBreakerConfig() {
        return new CircuitBreakerConfig(failureThreshold, Duration.ofSeconds(cooldownSeconds), successThreshold);
    }
}

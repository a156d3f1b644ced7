package com.botanical.ingestion.client;

import com.botanical.ingestion.cache.NoOpResponseCache;
import com.botanical.ingestion.cache.ResponseCache;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.logging.LogContext;
import com.botanical.ingestion.metrics.MetricsCircuitStateListener;
import com.botanical.ingestion.metrics.MetricsService;
import com.botanical.ingestion.metrics.NoOpMetricsService;
import com.botanical.ingestion.tracing.NoOpTracingService;
import com.botanical.ingestion.tracing.Span;
import com.botanical.ingestion.tracing.TracingService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Base class for provider HTTP clients.
 *
 * <p>Each call goes through, in order: credential check, request counter, rate
 * limiter, circuit breaker, retry loop, and finally a single HTTP GET under a
 * hard timeout. Every client instance owns its own breaker, limiter and
 * counters.</p>
 */
public abstract class ResilientProviderClient implements BotanicalProvider {
    private static final Logger log = LoggerFactory.getLogger(ResilientProviderClient.class);

    private final Provider provider;
    private final String authParam;
    private final ProviderClientConfig config;
    private final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final ResponseCache cache;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final StatsTracker stats = new StatsTracker();
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    protected final Clock clock;

    protected ResilientProviderClient(Provider provider, String authParam, Builder<?> builder) {
        this.provider = provider;
        this.authParam = authParam;
        this.config = new ProviderClientConfig(
                builder.baseUrl,
                builder.apiKey,
                builder.requestTimeout != null ? builder.requestTimeout : ProviderClientConfig.DEFAULT_REQUEST_TIMEOUT,
                builder.minRequestSpacing,
                builder.cacheTtl != null ? builder.cacheTtl : ProviderClientConfig.DEFAULT_CACHE_TTL);
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.cache = builder.cache != null ? builder.cache : new NoOpResponseCache();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.system();

        this.rateLimiter = new RateLimiter(provider, config.minRequestSpacing(), clock, sleeper);
        this.circuitBreaker = new CircuitBreaker(provider,
                builder.circuitBreakerConfig != null ? builder.circuitBreakerConfig : CircuitBreakerConfig.defaults(),
                clock);
        this.circuitBreaker.addListener(new MetricsCircuitStateListener(metrics));
        this.retryExecutor = new RetryExecutor(provider,
                builder.retryConfig != null ? builder.retryConfig : RetryConfig.defaults(),
                new ErrorClassifier(builder.rateLimitWait != null ? builder.rateLimitWait : ErrorClassifier.DEFAULT_RATE_LIMIT_WAIT),
                stats, sleeper, metrics);

        log.info("{} client initialized: {}", provider.displayName(), config);
    }

    /**
     * Performs a resilient GET of {@code endpoint} and decodes the body into {@code type}.
     */
    protected <T> T execute(String endpoint, Map<String, ?> params, Class<T> type) {
        if (!config.hasApiKey()) {
            throw new ProviderConfigurationException(provider,
                    provider.displayName() + " API key is not configured");
        }
        URI uri = buildUri(endpoint, params);
        stats.recordRequest();
        rateLimiter.throttle();

        long startNanos = System.nanoTime();
        try (LogContext ignored = LogContext.forProviderRequest(LogContext.generateCorrelationId(), provider, endpoint);
             Span span = tracing.startProviderSpan(provider, endpoint)) {
            try {
                T result = circuitBreaker.execute(() -> retryExecutor.runWithRetry(() -> attempt(endpoint, uri, type)));
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                stats.recordSuccess(elapsed);
                metrics.recordProviderRequest(provider, true, elapsed);
                span.setAttribute("durationMs", elapsed.toMillis());
                span.setStatus(Span.SpanStatus.OK);
                log.debug("provider.request.succeeded endpoint={} durationMs={}", endpoint, elapsed.toMillis());
                return result;
            } catch (RuntimeException e) {
                stats.recordFailure();
                if (e instanceof CircuitOpenException) {
                    stats.recordCircuitBreakerTrip();
                }
                metrics.recordProviderRequest(provider, false, Duration.ofNanos(System.nanoTime() - startNanos));
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.warn("provider.request.failed endpoint={} error={}", endpoint, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Returns the cached value under {@code cacheKey}, or loads and caches it.
     */
    protected <T> T executeCached(String cacheKey, Duration ttl, Class<T> type, Supplier<T> loader) {
        Optional<T> cached = cache.get(cacheKey, type);
        if (cached.isPresent()) {
            metrics.recordCacheHit(provider);
            log.debug("provider.cache.hit key={}", cacheKey);
            return cached.get();
        }
        metrics.recordCacheMiss(provider);
        T value = loader.get();
        cache.set(cacheKey, value, ttl != null ? ttl : config.cacheTtl());
        return value;
    }

    /**
     * Builds a cache key of the form {@code provider:resource:part1:part2}.
     */
    protected String cacheKey(String resource, Object... parts) {
        StringJoiner joiner = new StringJoiner(":");
        joiner.add(provider.key()).add(resource);
        for (Object part : parts) {
            joiner.add(String.valueOf(part));
        }
        return joiner.toString();
    }

    /**
     * Encodes one path segment, such as a slug or an id, for use in an endpoint.
     */
    protected static String pathSegment(Object value) {
        return encode(String.valueOf(value)).replace("+", "%20");
    }

    private <T> T attempt(String endpoint, URI uri, Class<T> type) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(config.requestTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();

        log.debug("provider.request GET {}", endpoint);
        HttpResponse<String> response = send(endpoint, request);

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            if (status == 429) {
                stats.recordRateLimit();
            }
            throw new ProviderApiException(provider, status, errorMessage(response));
        }

        try {
            return objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new ProviderException(provider,
                    "Malformed " + provider.displayName() + " response from " + endpoint + ": " + e.getOriginalMessage(), e);
        }
    }

    private HttpResponse<String> send(String endpoint, HttpRequest request) {
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            return future.get(config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            stats.recordTimeout();
            throw new ProviderTimeoutException(provider, endpoint, config.requestTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                stats.recordTimeout();
                throw new ProviderTimeoutException(provider, endpoint, config.requestTimeout());
            }
            stats.recordNetworkError();
            throw new ProviderNetworkException(provider, endpoint, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderInterruptedException(provider, "Interrupted awaiting " + endpoint, e);
        }
    }

    /**
     * The query carries the credential, so failures report the endpoint only.
     */
    private URI buildUri(String endpoint, Map<String, ?> params) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put(authParam, config.apiKey());
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    query.put(key, value);
                }
            });
        }
        StringJoiner joiner = new StringJoiner("&");
        query.forEach((key, value) -> joiner.add(encode(key) + "=" + encode(String.valueOf(value))));
        try {
            return new URI(config.baseUrl() + endpoint + "?" + joiner);
        } catch (URISyntaxException e) {
            // not chained: the cause's input holds the credential
            throw new ProviderRequestException(provider, "Invalid " + provider.displayName()
                    + " request URI for endpoint " + endpoint + " at index " + e.getIndex());
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Uses the provider's {@code message} or {@code error} field when the body is JSON.
     */
    private String errorMessage(HttpResponse<String> response) {
        String body = response.body();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                for (String field : new String[]{"message", "error"}) {
                    JsonNode value = node.path(field);
                    if (value.isTextual() && !value.asText().isBlank()) {
                        return value.asText();
                    }
                }
            } catch (JsonProcessingException e) {
                log.debug("provider.errorBody.notJson status={}", response.statusCode());
            }
        }
        return "HTTP " + response.statusCode();
    }

    @Override
    public Provider getProvider() {
        return provider;
    }

    @Override
    public boolean isConfigured() {
        return config.hasApiKey();
    }

    @Override
    public RetryStats getStats() {
        return stats.getStats();
    }

    @Override
    public CircuitState getCircuitState() {
        return circuitBreaker.getState();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public ProviderClientConfig getConfig() {
        return config;
    }

    @Override
    public void reset() {
        circuitBreaker.reset();
        stats.reset();
        log.info("{} client reset", provider.displayName());
    }

    /**
     * Shared builder for provider clients.
     *
     * @param <B> the concrete builder type
     */
    public abstract static class Builder<B extends Builder<B>> {
        private String baseUrl;
        private String apiKey;
        private Duration requestTimeout;
        private Duration minRequestSpacing;
        private Duration cacheTtl;
        private Duration rateLimitWait;
        private RetryConfig retryConfig;
        private CircuitBreakerConfig circuitBreakerConfig;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;
        private ResponseCache cache;
        private MetricsService metrics;
        private TracingService tracing;
        private Clock clock;
        private Sleeper sleeper;

        protected Builder(String defaultBaseUrl, Duration defaultSpacing) {
            this.baseUrl = defaultBaseUrl;
            this.minRequestSpacing = defaultSpacing;
        }

        protected abstract B self();

        public B baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return self();
        }

        public B apiKey(String apiKey) {
            this.apiKey = apiKey;
            return self();
        }

        public B requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return self();
        }

        public B minRequestSpacing(Duration minRequestSpacing) {
            this.minRequestSpacing = minRequestSpacing;
            return self();
        }

        public B cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return self();
        }

        public B rateLimitWait(Duration rateLimitWait) {
            this.rateLimitWait = rateLimitWait;
            return self();
        }

        public B retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return self();
        }

        public B circuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig) {
            this.circuitBreakerConfig = circuitBreakerConfig;
            return self();
        }

        public B httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return self();
        }

        public B objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return self();
        }

        public B cache(ResponseCache cache) {
            this.cache = cache;
            return self();
        }

        public B metrics(MetricsService metrics) {
            this.metrics = metrics;
            return self();
        }

        public B tracing(TracingService tracing) {
            this.tracing = tracing;
            return self();
        }

        public B clock(Clock clock) {
            this.clock = clock;
            return self();
        }

        public B sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return self();
        }
    }
}

package com.botanical.ingestion.client;

import java.time.Duration;

/**
 * Resolved connection settings of one provider client.
 *
 * @param baseUrl           API root, without trailing slash
 * @param apiKey            credential sent as a query parameter; may be blank, in which case calls fail fast
 * @param requestTimeout    hard limit on a single HTTP attempt
 * @param minRequestSpacing minimum gap between consecutive requests
 * @param cacheTtl          time-to-live for cached responses
 */
public record ProviderClientConfig(
        String baseUrl,
        String apiKey,
        Duration requestTimeout,
        Duration minRequestSpacing,
        Duration cacheTtl
) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);

    public ProviderClientConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
        if (minRequestSpacing == null || minRequestSpacing.isNegative()) {
            throw new IllegalArgumentException("minRequestSpacing must be >= 0");
        }
        if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must be > 0");
        }
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderClientConfig{" +
                "baseUrl='" + baseUrl + '\'' +
                ", apiKey=" + (hasApiKey() ? "****" : "<unset>") +
                ", requestTimeout=" + requestTimeout +
                ", minRequestSpacing=" + minRequestSpacing +
                ", cacheTtl=" + cacheTtl +
                '}';
    }
}

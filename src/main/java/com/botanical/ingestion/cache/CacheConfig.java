package com.botanical.ingestion.cache;

/**
 * Configuration for the provider response cache.
 *
 * @param maxSize           maximum number of entries
 * @param defaultTtlSeconds time-to-live used when a caller does not pass one
 * @param enabled           whether caching is enabled
 */
public record CacheConfig(int maxSize, int defaultTtlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 5,000 entries, one hour TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 3_600, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}

package com.botanical.ingestion.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache for decoded provider responses.
 *
 * <p>Keys are namespaced by provider and resource, e.g. {@code trefle:plant:123}
 * or {@code perenual:species-list:1:20}. Implementations must be thread-safe.</p>
 */
public interface ResponseCache {

    /**
     * Returns the cached value for {@code key} if present, unexpired and of the requested type.
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Stores {@code value} under {@code key} for {@code ttl}.
     */
    void set(String key, Object value, Duration ttl);

    void invalidate(String key);

    void invalidateAll();

    CacheStats getStats();
}

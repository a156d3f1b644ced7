package com.botanical.ingestion.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache that never stores anything; every lookup goes to the provider.
 */
public class NoOpResponseCache implements ResponseCache {

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
    }

    @Override
    public void invalidate(String key) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}

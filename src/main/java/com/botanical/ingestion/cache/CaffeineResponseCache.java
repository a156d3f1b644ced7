package com.botanical.ingestion.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed response cache with a per-entry time-to-live.
 */
public class CaffeineResponseCache implements ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResponseCache.class);

    private final Cache<String, CachedValue> cache;

    public CaffeineResponseCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    CaffeineResponseCache(CacheConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("CaffeineResponseCache initialized: maxSize={}, defaultTtl={}s",
                config.maxSize(), config.defaultTtlSeconds());
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        CachedValue cached = cache.getIfPresent(key);
        if (cached == null) {
            return Optional.empty();
        }
        if (!type.isInstance(cached.value())) {
            log.warn("cache.typeMismatch key={} expected={} actual={}",
                    key, type.getSimpleName(), cached.value().getClass().getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(cached.value()));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        cache.put(key, new CachedValue(value, ttl.toNanos()));
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CachedValue(Object value, long ttlNanos) {}

    private static final class PerEntryExpiry implements Expiry<String, CachedValue> {

        @Override
        public long expireAfterCreate(String key, CachedValue value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedValue value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

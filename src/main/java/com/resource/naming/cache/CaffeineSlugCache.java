package com.resource.naming.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.resource.naming.core.model.SlugMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed slug cache.
 */
public class CaffeineSlugCache implements SlugCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSlugCache.class);

    private final Cache<String, SlugMapping> cache;

    public CaffeineSlugCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("slug.cache.initialized maxSize={} ttl={}", config.maxSize(), config.ttl());
    }

    /**
     * Builds a Caffeine cache when enabled, otherwise a no-op cache.
     */
    public static SlugCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineSlugCache(config) : new NoOpSlugCache();
    }

    @Override
    public Optional<SlugMapping> get(String lookupKey) {
        return Optional.ofNullable(cache.getIfPresent(lookupKey));
    }

    @Override
    public void put(String lookupKey, SlugMapping mapping) {
        cache.put(lookupKey, mapping);
    }

    @Override
    public void invalidate(String lookupKey) {
        cache.invalidate(lookupKey);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("slug.cache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(true, stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}

package com.resource.naming.cache;

import com.resource.naming.core.model.SlugMapping;

import java.util.Optional;

/**
 * No-op cache implementation. Used when caching is disabled.
 */
public class NoOpSlugCache implements SlugCache {

    @Override
    public Optional<SlugMapping> get(String lookupKey) {
        return Optional.empty();
    }

    @Override
    public void put(String lookupKey, SlugMapping mapping) {
        // no-op
    }

    @Override
    public void invalidate(String lookupKey) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.disabled();
    }
}

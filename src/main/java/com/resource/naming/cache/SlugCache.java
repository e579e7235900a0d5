package com.resource.naming.cache;

import com.resource.naming.core.model.SlugMapping;

import java.util.Optional;

/**
 * Cache of resolved slugs, keyed by the normalized lookup input.
 */
public interface SlugCache {

    Optional<SlugMapping> get(String lookupKey);

    void put(String lookupKey, SlugMapping mapping);

    void invalidate(String lookupKey);

    /**
     * Drops every entry. Called after a slug sync.
     */
    void invalidateAll();

    CacheStats getStats();
}

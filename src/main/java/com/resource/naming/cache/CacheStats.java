package com.resource.naming.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time counters of the slug cache, reported through the health endpoint.
 *
 * @param enabled       false when lookups bypass the cache entirely
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups that walked the provider chain
 * @param evictionCount entries dropped for size or age; sync invalidations are not counted
 * @param size          approximate number of cached lookups
 */
public record CacheStats(boolean enabled, long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats disabled() {
        return new CacheStats(false, 0, 0, 0, 0);
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("enabled", enabled);
        if (enabled) {
            details.put("size", size);
            details.put("hits", hitCount);
            details.put("misses", missCount);
            details.put("evictions", evictionCount);
            details.put("hitRate", Math.round(hitRate() * 1000) / 1000.0);
        }
        return details;
    }
}

package com.resource.naming.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the slug cache. Slugs change only through a sync, which invalidates the whole
 * cache, so the TTL only bounds how long a mapping deleted out of band can linger.
 *
 * @param maxSize maximum number of cached lookups; ignored when disabled
 * @param ttl     lifetime of a cached lookup; ignored when disabled
 * @param enabled false selects {@link NoOpSlugCache}
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public static final int DEFAULT_MAX_SIZE = 1_000;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (enabled && maxSize <= 0) {
            throw new IllegalArgumentException("slug cache maxSize must be > 0, got " + maxSize);
        }
        if (enabled && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("slug cache ttl must be positive, got " + ttl);
        }
    }

    public static CacheConfig of(int maxSize, long ttlSeconds) {
        return new CacheConfig(maxSize, Duration.ofSeconds(ttlSeconds), true);
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE, DEFAULT_TTL, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(0, Duration.ZERO, false);
    }
}

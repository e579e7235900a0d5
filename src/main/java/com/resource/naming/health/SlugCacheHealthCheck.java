package com.resource.naming.health;

import com.resource.naming.cache.CacheStats;
import com.resource.naming.slug.SlugResolver;

/**
 * Reports the slug cache counters. Resolution still works with the cache off, so this never fails the service.
 */
public class SlugCacheHealthCheck implements HealthCheck {

    private final SlugResolver resolver;

    public SlugCacheHealthCheck(SlugResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public String getName() {
        return "slug-cache";
    }

    @Override
    public boolean isCritical() {
        return false;
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = resolver.cacheStats();
        HealthStatus status = HealthStatus.up(stats.enabled() ? "cache enabled" : "cache disabled");
        for (var detail : stats.toDetails().entrySet()) {
            status = status.withDetail(detail.getKey(), detail.getValue());
        }
        return status;
    }
}

package com.resource.naming.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link NamingMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code naming.claim.duration}: Timer (tags: resourceType, outcome)</li>
 *   <li>{@code naming.claim.succeeded}: Counter (tag: resourceType)</li>
 *   <li>{@code naming.claim.conflict}: Counter (tag: resourceType)</li>
 *   <li>{@code naming.claim.retry}: Counter (tag: resourceType)</li>
 *   <li>{@code naming.release}: Counter (tag: outcome)</li>
 *   <li>{@code naming.audit.append.failed}: Counter (tag: action)</li>
 *   <li>{@code naming.slug.cache.hit} / {@code naming.slug.cache.miss}: Counter</li>
 *   <li>{@code naming.slug.sync.updated} / {@code naming.slug.sync.rejected}: Counter</li>
 * </ul>
 */
public class MicrometerNamingMetrics implements NamingMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter syncUpdatedCounter;
    private final Counter syncRejectedCounter;

    public MicrometerNamingMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("naming.slug.cache.hit")
                .description("Number of slug cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("naming.slug.cache.miss")
                .description("Number of slug cache misses")
                .register(registry);
        this.syncUpdatedCounter = Counter.builder("naming.slug.sync.updated")
                .description("Number of slug mappings written by sync")
                .register(registry);
        this.syncRejectedCounter = Counter.builder("naming.slug.sync.rejected")
                .description("Number of feed entries rejected by sync")
                .register(registry);
    }

    @Override
    public void recordClaimDuration(String resourceType, String outcome, Duration duration) {
        String type = resourceType != null ? resourceType : "unknown";
        Timer timer = timerCache.computeIfAbsent(type + ":" + outcome, k ->
                Timer.builder("naming.claim.duration")
                        .description("Duration of claim operations")
                        .tag("resourceType", type)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementClaimSucceeded(String resourceType) {
        counter("naming.claim.succeeded", "Number of names claimed", "resourceType", resourceType).increment();
    }

    @Override
    public void incrementClaimConflict(String resourceType) {
        counter("naming.claim.conflict", "Number of claims rejected as already existing",
                "resourceType", resourceType).increment();
    }

    @Override
    public void incrementClaimRetry(String resourceType) {
        counter("naming.claim.retry", "Number of alternate candidates tried after a conflict",
                "resourceType", resourceType).increment();
    }

    @Override
    public void incrementRelease(String outcome) {
        counter("naming.release", "Number of release requests by outcome", "outcome", outcome).increment();
    }

    @Override
    public void incrementAuditAppendFailed(String action) {
        counter("naming.audit.append.failed", "Number of audit writes that failed after commit",
                "action", action).increment();
    }

    @Override
    public void recordSlugCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordSlugCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordSlugSync(int updated, int rejected) {
        syncUpdatedCounter.increment(updated);
        syncRejectedCounter.increment(rejected);
    }

    private Counter counter(String name, String description, String tag, String value) {
        String tagValue = value != null ? value : "unknown";
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, tagValue)
                        .register(registry));
    }
}

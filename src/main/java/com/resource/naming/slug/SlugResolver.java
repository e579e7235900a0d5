package com.resource.naming.slug;

import com.resource.naming.cache.CacheStats;
import com.resource.naming.cache.NoOpSlugCache;
import com.resource.naming.cache.SlugCache;
import com.resource.naming.core.model.SlugMapping;
import com.resource.naming.error.NotFoundException;
import com.resource.naming.error.ValidationException;
import com.resource.naming.metrics.NamingMetrics;
import com.resource.naming.metrics.NoOpNamingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves a resource type, or its human-readable full name, to a slug by walking an
 * ordered provider chain. Underscore and space forms are equivalent lookup keys.
 *
 * <p>Cache writes are tagged with the invalidation generation seen before the provider lookup.
 * A write that overlaps {@link #invalidateCache()} is removed again, so a sync never leaves a
 * pre-sync mapping behind in the cache.</p>
 */
public class SlugResolver {
    private static final Logger log = LoggerFactory.getLogger(SlugResolver.class);

    public static final int MAX_INPUT_LENGTH = 256;

    private final List<SlugProvider> providers;
    private final SlugCache cache;
    private final NamingMetrics metrics;
    private final AtomicLong cacheGeneration = new AtomicLong();

    public SlugResolver(List<SlugProvider> providers) {
        this(providers, new NoOpSlugCache(), new NoOpNamingMetrics());
    }

    public SlugResolver(List<SlugProvider> providers, SlugCache cache, NamingMetrics metrics) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("at least one slug provider is required");
        }
        this.providers = List.copyOf(providers);
        this.cache = cache;
        this.metrics = metrics;
    }

    public String resolve(String resourceTypeOrFullName) {
        return resolveMapping(resourceTypeOrFullName).slug();
    }

    /**
     * @throws ValidationException if the input is blank or too long
     * @throws NotFoundException   if no provider knows the input
     */
    public SlugMapping resolveMapping(String resourceTypeOrFullName) {
        Set<String> candidates = candidates(resourceTypeOrFullName);
        String lookupKey = candidates.iterator().next();

        Optional<SlugMapping> cached = cache.get(lookupKey);
        if (cached.isPresent()) {
            metrics.recordSlugCacheHit();
            return cached.get();
        }
        metrics.recordSlugCacheMiss();

        long generation = cacheGeneration.get();
        for (SlugProvider provider : providers) {
            for (String candidate : candidates) {
                Optional<SlugMapping> match = provider.find(candidate);
                if (match.isPresent()) {
                    log.debug("slug.resolved input={} provider={} slug={}",
                            lookupKey, provider.name(), match.get().slug());
                    cacheIfCurrent(lookupKey, match.get(), generation);
                    return match.get();
                }
            }
        }
        throw new NotFoundException("No slug found for resource type '" + resourceTypeOrFullName + "'");
    }

    /**
     * Drops cached resolutions. Called after a sync.
     */
    public void invalidateCache() {
        cacheGeneration.incrementAndGet();
        cache.invalidateAll();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    private void cacheIfCurrent(String lookupKey, SlugMapping mapping, long generation) {
        cache.put(lookupKey, mapping);
        if (cacheGeneration.get() != generation) {
            cache.invalidate(lookupKey);
        }
    }

    public List<String> providerNames() {
        return providers.stream().map(SlugProvider::name).toList();
    }

    /**
     * Lookup candidates in order: the trimmed lowercase input, its underscore form, its space form.
     */
    static Set<String> candidates(String input) {
        if (input == null || input.isBlank()) {
            throw new ValidationException("resourceType is required");
        }
        if (input.length() > MAX_INPUT_LENGTH) {
            throw new ValidationException("resourceType must be at most " + MAX_INPUT_LENGTH + " characters");
        }
        String base = input.trim().toLowerCase(Locale.ROOT);
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(base);
        candidates.add(base.replaceAll("\\s+", "_"));
        candidates.add(base.replace('_', ' '));
        return candidates;
    }
}

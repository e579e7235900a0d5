package com.resource.naming.slug;

import com.resource.naming.metrics.NamingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Writes a parsed upstream snapshot into the slug table and clears resolver caches.
 * Fetching the snapshot is the caller's job.
 */
public class SlugSyncService {
    private static final Logger log = LoggerFactory.getLogger(SlugSyncService.class);

    /**
     * @param updatedCount  mappings written
     * @param rejectedCount feed entries dropped by validation
     * @param syncedAt      completion time
     */
    public record SyncSummary(int updatedCount, int rejectedCount, Instant syncedAt) {}

    private final SlugFeedParser parser;
    private final SlugRepository repository;
    private final SlugResolver resolver;
    private final NamingMetrics metrics;

    public SlugSyncService(SlugFeedParser parser, SlugRepository repository,
                           SlugResolver resolver, NamingMetrics metrics) {
        this.parser = parser;
        this.repository = repository;
        this.resolver = resolver;
        this.metrics = metrics;
    }

    /**
     * @throws com.resource.naming.error.UpstreamException if the snapshot cannot be parsed
     */
    public SyncSummary sync(String snapshot) {
        SlugFeedParser.ParseResult parsed = parser.parse(snapshot);
        int updated = repository.upsertAll(parsed.mappings());
        resolver.invalidateCache();
        metrics.recordSlugSync(updated, parsed.rejected());
        log.info("slug.sync.completed updated={} rejected={}", updated, parsed.rejected());
        return new SyncSummary(updated, parsed.rejected(), Instant.now());
    }
}

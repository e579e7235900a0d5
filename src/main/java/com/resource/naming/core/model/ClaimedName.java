package com.resource.naming.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A name reserved in the ledger for one region and environment.
 * A row moves from in use to released; a later claim of the same name replaces a released row.
 */
public record ClaimedName(
        String name,
        String region,
        String environment,
        String resourceType,
        String slug,
        boolean inUse,
        String claimedBy,
        Instant claimedAt,
        String releasedBy,
        Instant releasedAt,
        String releaseReason,
        Map<String, String> segments,
        Map<String, String> metadata
) {
    public ClaimedName {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(environment, "environment is required");
        Objects.requireNonNull(claimedBy, "claimedBy is required");
        Objects.requireNonNull(claimedAt, "claimedAt is required");
        segments = segments != null ? Map.copyOf(segments) : Map.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public ClaimKey key() {
        return ClaimKey.of(region, environment, name);
    }

    /**
     * Returns a copy of this claim marked as released.
     */
    public ClaimedName release(String actor, Instant at, String reason) {
        return new ClaimedName(name, region, environment, resourceType, slug, false,
                claimedBy, claimedAt, actor, at, reason, segments, metadata);
    }

    /**
     * Metadata in key order, for responses and audit snapshots.
     */
    public Map<String, String> sortedMetadata() {
        return new TreeMap<>(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String region;
        private String environment;
        private String resourceType;
        private String slug;
        private boolean inUse = true;
        private String claimedBy;
        private Instant claimedAt = Instant.now();
        private String releasedBy;
        private Instant releasedAt;
        private String releaseReason;
        private Map<String, String> segments;
        private Map<String, String> metadata;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder inUse(boolean inUse) {
            this.inUse = inUse;
            return this;
        }

        public Builder claimedBy(String claimedBy) {
            this.claimedBy = claimedBy;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder releasedBy(String releasedBy) {
            this.releasedBy = releasedBy;
            return this;
        }

        public Builder releasedAt(Instant releasedAt) {
            this.releasedAt = releasedAt;
            return this;
        }

        public Builder releaseReason(String releaseReason) {
            this.releaseReason = releaseReason;
            return this;
        }

        public Builder segments(Map<String, String> segments) {
            this.segments = segments;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public ClaimedName build() {
            return new ClaimedName(name, region, environment, resourceType, slug, inUse,
                    claimedBy, claimedAt, releasedBy, releasedAt, releaseReason, segments, metadata);
        }
    }
}

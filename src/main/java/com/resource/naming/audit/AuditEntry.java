package com.resource.naming.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Immutable, append-only record of a claim or release.
 * Metadata is already sanitized when an entry is built.
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String name,
        String actor,
        String region,
        String environment,
        String note,
        Map<String, String> metadata,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        metadata = metadata != null ? Map.copyOf(new TreeMap<>(metadata)) : Map.of();
    }

    public String partition() {
        return region + "-" + environment;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String name;
        private String actor;
        private String region;
        private String environment;
        private String note;
        private Map<String, String> metadata;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
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

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, name, actor, region, environment, note, metadata, timestamp);
        }
    }
}

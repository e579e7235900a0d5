package com.resource.naming.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of a claim.
 *
 * @param resourceType resource type or its full name, e.g. {@code storage_account}
 * @param region       region code, e.g. {@code wus2}
 * @param environment  environment code, e.g. {@code prod}
 * @param segments     optional segment values keyed by field name (system, index, ...)
 * @param metadata     caller metadata stored with the claim after sanitization
 * @param sessionId    session whose stored defaults apply, may be null
 */
public record ClaimRequest(
        String resourceType,
        String region,
        String environment,
        Map<String, String> segments,
        Map<String, Object> metadata,
        String sessionId
) {
    public ClaimRequest {
        segments = segments != null ? copy(segments) : Map.of();
        metadata = metadata != null ? copy(metadata) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    // tolerates null values, which Map.copyOf rejects
    private static <V> Map<String, V> copy(Map<String, V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static class Builder {
        private String resourceType;
        private String region;
        private String environment;
        private final Map<String, String> segments = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String sessionId;

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
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

        public Builder segment(String field, String value) {
            this.segments.put(field, value);
            return this;
        }

        public Builder segments(Map<String, String> segments) {
            this.segments.putAll(segments);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata.putAll(metadata);
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public ClaimRequest build() {
            return new ClaimRequest(resourceType, region, environment, segments, metadata, sessionId);
        }
    }
}

package com.resource.naming.rest.dto;

import com.resource.naming.api.ClaimRequest;

import java.util.Map;

/**
 * Request DTO for claiming a name. Region and environment may be omitted when the
 * caller has stored defaults.
 */
public record ClaimNameRequest(
        String resourceType,
        String region,
        String environment,
        Map<String, String> segments,
        Map<String, Object> metadata,
        String sessionId
) {
    public ClaimNameRequest {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType is required");
        }
    }

    public ClaimRequest toClaimRequest() {
        return new ClaimRequest(resourceType, region, environment, segments, metadata, sessionId);
    }
}

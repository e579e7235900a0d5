package com.resource.naming.rest.dto;

import com.resource.naming.api.ReleaseRequest;
import com.resource.naming.core.model.VersionToken;

/**
 * Request DTO for releasing a name. {@code expectedVersion} is the version returned by the
 * last read and is required.
 */
public record ReleaseNameRequest(
        String region,
        String environment,
        String name,
        String reason,
        String expectedVersion
) {
    public ReleaseNameRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (expectedVersion == null || expectedVersion.isBlank()) {
            throw new IllegalArgumentException("expectedVersion is required");
        }
    }

    public ReleaseRequest toReleaseRequest() {
        return new ReleaseRequest(region, environment, name, reason, VersionToken.of(expectedVersion));
    }
}

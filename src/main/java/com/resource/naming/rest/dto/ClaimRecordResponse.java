package com.resource.naming.rest.dto;

import com.resource.naming.core.model.ClaimedName;
import com.resource.naming.core.model.VersionToken;
import com.resource.naming.core.model.VersionedClaim;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a ledger row and the version it was read at.
 */
public record ClaimRecordResponse(
        String name,
        String region,
        String environment,
        String resourceType,
        String slug,
        boolean inUse,
        String claimedBy,
        String claimedAt,
        String releasedBy,
        String releasedAt,
        String releaseReason,
        Map<String, String> segments,
        Map<String, String> metadata,
        String version,
        List<String> warnings
) {
    public static ClaimRecordResponse from(VersionedClaim versioned) {
        return from(versioned.claim(), versioned.version(), List.of());
    }

    public static ClaimRecordResponse from(ClaimedName claim, VersionToken version, List<String> warnings) {
        return new ClaimRecordResponse(
                claim.name(),
                claim.region(),
                claim.environment(),
                claim.resourceType(),
                claim.slug(),
                claim.inUse(),
                claim.claimedBy(),
                format(claim.claimedAt()),
                claim.releasedBy(),
                format(claim.releasedAt()),
                claim.releaseReason(),
                claim.segments(),
                claim.metadata(),
                version != null ? version.value() : null,
                warnings
        );
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}

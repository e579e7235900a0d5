package com.resource.naming.rest.dto;

import com.resource.naming.api.ClaimResult;
import com.resource.naming.api.ResultWarning;
import com.resource.naming.rules.DisplayValue;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a successful claim.
 */
public record ClaimResponse(
        String name,
        String resourceType,
        String region,
        String environment,
        String slug,
        String claimedBy,
        Map<String, String> metadata,
        List<DisplayValue> display,
        String summary,
        String version,
        List<String> warnings
) {
    public static ClaimResponse from(ClaimResult result) {
        return new ClaimResponse(
                result.name(),
                result.resourceType(),
                result.region(),
                result.environment(),
                result.slug(),
                result.claimedBy(),
                result.metadata(),
                result.display(),
                result.summary(),
                result.version() != null ? result.version().value() : null,
                result.warnings().stream().map(ResultWarning::name).toList()
        );
    }
}

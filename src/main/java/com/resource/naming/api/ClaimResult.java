package com.resource.naming.api;

import com.resource.naming.core.model.VersionToken;
import com.resource.naming.rules.DisplayValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a claim. On success every name field is set; on failure only status and message.
 */
public record ClaimResult(
        ResultStatus status,
        String message,
        String name,
        String resourceType,
        String region,
        String environment,
        String slug,
        String claimedBy,
        Map<String, String> metadata,
        List<DisplayValue> display,
        String summary,
        VersionToken version,
        List<ResultWarning> warnings
) {
    public ClaimResult {
        Objects.requireNonNull(status, "status is required");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        display = display != null ? List.copyOf(display) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ClaimResult failure(ResultStatus status, String message) {
        return new ClaimResult(status, message, null, null, null, null, null, null,
                Map.of(), List.of(), null, null, List.of());
    }

    public boolean isClaimed() {
        return status == ResultStatus.SUCCESS;
    }

    public boolean hasWarning(ResultWarning warning) {
        return warnings.contains(warning);
    }

    public ClaimResult withWarning(ResultWarning warning) {
        List<ResultWarning> updated = new ArrayList<>(warnings);
        updated.add(warning);
        return new ClaimResult(status, message, name, resourceType, region, environment, slug, claimedBy,
                metadata, display, summary, version, updated);
    }
}

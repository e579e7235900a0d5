package com.resource.naming.api;

import com.resource.naming.core.model.ClaimedName;
import com.resource.naming.core.model.VersionToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a release. On success carries the released row and its new version.
 */
public record ReleaseResult(
        ResultStatus status,
        String message,
        ClaimedName claim,
        VersionToken version,
        List<ResultWarning> warnings
) {
    public ReleaseResult {
        Objects.requireNonNull(status, "status is required");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ReleaseResult released(ClaimedName claim, VersionToken version) {
        return new ReleaseResult(ResultStatus.SUCCESS,
                "Name '" + claim.name() + "' released", claim, version, List.of());
    }

    public static ReleaseResult failure(ResultStatus status, String message) {
        return new ReleaseResult(status, message, null, null, List.of());
    }

    public boolean isReleased() {
        return status == ResultStatus.SUCCESS;
    }

    public boolean hasWarning(ResultWarning warning) {
        return warnings.contains(warning);
    }

    public ReleaseResult withWarning(ResultWarning warning) {
        List<ResultWarning> updated = new ArrayList<>(warnings);
        updated.add(warning);
        return new ReleaseResult(status, message, claim, version, updated);
    }
}

package com.resource.naming.core.model;

import java.util.Objects;

/**
 * A ledger row together with the version it was read at.
 */
public record VersionedClaim(ClaimedName claim, VersionToken version) {

    public VersionedClaim {
        Objects.requireNonNull(claim, "claim is required");
        Objects.requireNonNull(version, "version is required");
    }
}

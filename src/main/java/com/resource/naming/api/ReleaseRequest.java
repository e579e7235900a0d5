package com.resource.naming.api;

import com.resource.naming.core.model.VersionToken;

/**
 * Input of a release.
 *
 * @param region          region code of the claim
 * @param environment     environment code of the claim
 * @param name            the claimed name
 * @param reason          free text, defaults to "not specified"
 * @param expectedVersion version the caller last read; required, a release without it is rejected
 */
public record ReleaseRequest(
        String region,
        String environment,
        String name,
        String reason,
        VersionToken expectedVersion
) {
    public static ReleaseRequest of(String region, String environment, String name, VersionToken expectedVersion) {
        return new ReleaseRequest(region, environment, name, null, expectedVersion);
    }
}

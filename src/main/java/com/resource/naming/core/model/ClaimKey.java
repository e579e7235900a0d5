package com.resource.naming.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Ledger key of a claimed name: partition {@code region-environment}, row {@code name}.
 * All parts are stored lowercase.
 */
public record ClaimKey(String region, String environment, String name) {

    public ClaimKey {
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(environment, "environment is required");
        Objects.requireNonNull(name, "name is required");
        region = region.trim().toLowerCase(Locale.ROOT);
        environment = environment.trim().toLowerCase(Locale.ROOT);
        name = name.trim().toLowerCase(Locale.ROOT);
    }

    public static ClaimKey of(String region, String environment, String name) {
        return new ClaimKey(region, environment, name);
    }

    public String partition() {
        return region + "-" + environment;
    }

    @Override
    public String toString() {
        return partition() + "/" + name;
    }
}

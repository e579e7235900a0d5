package com.resource.naming.security;

import java.util.Locale;

/**
 * Roles for naming operations.
 * Roles are hierarchical: ADMIN > CONTRIBUTOR > READER.
 */
public enum SecurityRole {

    /** Read-only access: slug lookups, rule discovery, own audit records. */
    READER,

    /** Read + write access: claim and release own names. */
    CONTRIBUTOR,

    /** Full access: release any name, query any audit record, sync slugs. */
    ADMIN;

    /**
     * Returns true if this role has sufficient privilege for the required role.
     */
    public boolean hasPermission(SecurityRole required) {
        return this.ordinal() >= required.ordinal();
    }

    /**
     * Elevated roles bypass ownership checks.
     */
    public boolean isElevated() {
        return this == ADMIN;
    }

    /**
     * Parses a role from string, case-insensitive.
     *
     * @param value the role name
     * @return the matching SecurityRole
     * @throws IllegalArgumentException if the value doesn't match any role
     */
    public static SecurityRole fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Security role must not be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

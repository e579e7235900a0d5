package com.resource.naming.audit;

import com.resource.naming.error.ValidationException;

import java.util.Locale;

/**
 * Types of auditable naming operations.
 */
public enum AuditAction {
    CLAIMED,
    RELEASED;

    /**
     * Lowercase wire form, e.g. {@code claimed}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses {@code claimed} / {@code released}, case-insensitive.
     *
     * @throws ValidationException for any other value
     */
    public static AuditAction fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (AuditAction action : values()) {
                if (action.name().equals(normalized)) {
                    return action;
                }
            }
        }
        throw new ValidationException("action must be one of [claimed, released]");
    }
}

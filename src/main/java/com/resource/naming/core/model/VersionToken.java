package com.resource.naming.core.model;

import java.util.Objects;

/**
 * Opaque version of a ledger row. Returned by every read and required by every conditional write.
 */
public record VersionToken(String value) implements Comparable<VersionToken> {

    public VersionToken {
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("version token must not be blank");
        }
    }

    public static VersionToken of(String value) {
        return new VersionToken(value);
    }

    public static VersionToken of(long sequence) {
        return new VersionToken(Long.toString(sequence));
    }

    @Override
    public int compareTo(VersionToken other) {
        if (value.length() != other.value.length()) {
            return Integer.compare(value.length(), other.value.length());
        }
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}

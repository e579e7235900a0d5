package com.resource.naming.rules;

/**
 * A rendered display entry.
 */
public record DisplayValue(String key, String label, String value, String description) {
}

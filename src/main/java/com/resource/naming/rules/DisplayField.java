package com.resource.naming.rules;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * How a payload field is presented in a claim response.
 */
public record DisplayField(String key, String label, String description, boolean optional) {

    public DisplayField {
        Objects.requireNonNull(key, "key is required");
        if (label == null || label.isBlank()) {
            label = titleCase(key);
        }
        if (description != null && description.isBlank()) {
            description = null;
        }
    }

    public static DisplayField of(String key, String label, boolean optional) {
        return new DisplayField(key, label, null, optional);
    }

    static String titleCase(String key) {
        return Arrays.stream(key.replace('_', ' ').trim().split("\\s+"))
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT)
                        + part.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}

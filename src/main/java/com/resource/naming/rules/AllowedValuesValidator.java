package com.resource.naming.rules;

import com.resource.naming.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Restricts fields to a fixed, case-insensitive set of values. Absent fields pass.
 */
public class AllowedValuesValidator implements PayloadValidator {

    private final Map<String, Set<String>> allowed;

    public AllowedValuesValidator(Map<String, ? extends Iterable<String>> allowed) {
        Map<String, Set<String>> normalized = new LinkedHashMap<>();
        allowed.forEach((field, values) -> {
            Set<String> set = new TreeSet<>();
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    set.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
            normalized.put(field, Set.copyOf(set));
        });
        this.allowed = Map.copyOf(normalized);
    }

    @Override
    public void validate(Map<String, String> payload) {
        for (Map.Entry<String, Set<String>> entry : allowed.entrySet()) {
            String raw = payload.get(entry.getKey());
            if (raw == null) {
                continue;
            }
            String value = raw.trim().toLowerCase(Locale.ROOT);
            if (!entry.getValue().contains(value)) {
                throw new ValidationException(entry.getKey() + " must be one of "
                        + new TreeSet<>(entry.getValue()).stream().collect(Collectors.joining(", ", "[", "]")));
            }
        }
    }

    @Override
    public String type() {
        return "allowed_values";
    }

    public Map<String, Set<String>> getAllowed() {
        return allowed;
    }
}

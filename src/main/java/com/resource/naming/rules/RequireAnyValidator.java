package com.resource.naming.rules;

import com.resource.naming.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * For each labelled group, at least one of the group's fields must carry a value.
 */
public class RequireAnyValidator implements PayloadValidator {

    private final Map<String, List<String>> groups;

    public RequireAnyValidator(Map<String, List<String>> groups) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        groups.forEach((label, fields) -> {
            if (fields == null || fields.isEmpty()) {
                throw new IllegalArgumentException("require_any group '" + label + "' must list at least one field");
            }
            copy.put(label, List.copyOf(fields));
        });
        this.groups = copy;
    }

    @Override
    public void validate(Map<String, String> payload) {
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            boolean satisfied = group.getValue().stream()
                    .anyMatch(field -> PayloadValidator.hasValue(payload.get(field)));
            if (!satisfied) {
                throw new ValidationException("One of (" + String.join(", ", group.getValue())
                        + ") must be provided for '" + group.getKey() + "'.");
            }
        }
    }

    @Override
    public String type() {
        return "require_any";
    }

    public Map<String, List<String>> getGroups() {
        return Map.copyOf(groups);
    }
}

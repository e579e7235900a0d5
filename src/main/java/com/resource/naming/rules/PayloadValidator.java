package com.resource.naming.rules;

import java.util.Map;

/**
 * Declarative check applied to a claim payload before a name is built.
 */
public interface PayloadValidator {

    /**
     * @throws com.resource.naming.error.ValidationException if the payload violates the check
     */
    void validate(Map<String, String> payload);

    /**
     * Short machine-readable name, used in rule descriptions.
     */
    String type();

    static boolean hasValue(String value) {
        return value != null && !value.isBlank();
    }
}

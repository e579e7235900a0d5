package com.resource.naming.rules;

import com.resource.naming.error.ValidationException;

import java.util.List;
import java.util.Map;

/**
 * Requires every listed field to carry a non-blank value.
 */
public class RequiredFieldsValidator implements PayloadValidator {

    private final List<String> required;

    public RequiredFieldsValidator(List<String> required) {
        this.required = List.copyOf(required);
    }

    @Override
    public void validate(Map<String, String> payload) {
        for (String field : required) {
            if (!PayloadValidator.hasValue(payload.get(field))) {
                throw new ValidationException(field + " is required for this resource type");
            }
        }
    }

    @Override
    public String type() {
        return "required";
    }

    public List<String> getRequired() {
        return required;
    }
}

package com.resource.naming.rules;

import com.resource.naming.error.ConfigurationException;

import java.util.List;

/**
 * One layer's partial rule definition. A {@code null} field is absent and inherits
 * from the rule it is merged onto.
 */
public record RuleFragment(
        List<String> segments,
        Integer maxLength,
        Boolean requireOrgPrefix,
        String nameTemplate,
        String summaryTemplate,
        List<DisplayField> displayFields,
        List<PayloadValidator> validators
) {
    public static final int DEFAULT_MAX_LENGTH = 80;

    public RuleFragment {
        segments = segments != null && !segments.isEmpty() ? List.copyOf(segments) : null;
        displayFields = displayFields != null ? List.copyOf(displayFields) : null;
        validators = validators != null && !validators.isEmpty() ? List.copyOf(validators) : null;
        if (nameTemplate != null && nameTemplate.isBlank()) {
            nameTemplate = null;
        }
        if (summaryTemplate != null && summaryTemplate.isBlank()) {
            summaryTemplate = null;
        }
    }

    /**
     * Merges this fragment onto a base rule; only fields set here replace the base's.
     *
     * @param base    the rule to inherit from, or null for a standalone fragment
     * @param context label used in error messages (layer and resource type)
     * @throws ConfigurationException if the result is incomplete or references unknown fields
     */
    public NamingRule mergeOnto(NamingRule base, String context) {
        List<String> mergedSegments = segments != null ? segments
                : base != null ? base.getSegments() : null;
        if (mergedSegments == null || mergedSegments.isEmpty()) {
            throw new ConfigurationException("Rule '" + context + "' must define segments");
        }

        int mergedMaxLength = maxLength != null ? maxLength
                : base != null ? base.getMaxLength() : DEFAULT_MAX_LENGTH;
        if (mergedMaxLength < 1) {
            throw new ConfigurationException("Rule '" + context + "' has max_length " + mergedMaxLength
                    + "; it must be at least 1");
        }

        NamingRule rule = NamingRule.builder()
                .segments(mergedSegments)
                .maxLength(mergedMaxLength)
                .requireOrgPrefix(requireOrgPrefix != null ? requireOrgPrefix
                        : base != null && base.isRequireOrgPrefix())
                .nameTemplate(nameTemplate != null ? nameTemplate
                        : base != null ? base.getNameTemplate() : null)
                .summaryTemplate(summaryTemplate != null ? summaryTemplate
                        : base != null ? base.getSummaryTemplate() : null)
                .displayFields(displayFields != null ? displayFields
                        : base != null ? base.getDisplayFields() : List.of())
                .validators(validators != null ? validators
                        : base != null ? base.getValidators() : List.of())
                .build();

        checkReferences(rule, context);
        return rule;
    }

    private static void checkReferences(NamingRule rule, String context) {
        for (String segment : rule.getSegments()) {
            if (RuleFields.isSegmentVariant(segment) || !RuleFields.isKnown(segment)) {
                throw new ConfigurationException("Rule '" + context + "' lists unknown segment '" + segment + "'");
            }
        }
        if (rule.hasTemplate()) {
            List<String> placeholders;
            try {
                placeholders = Templates.placeholders(rule.getNameTemplate());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Rule '" + context + "' has a malformed name_template: "
                        + e.getMessage(), e);
            }
            for (String placeholder : placeholders) {
                if (!RuleFields.isKnown(placeholder)) {
                    throw new ConfigurationException("Rule '" + context
                            + "' name_template references undefined field '" + placeholder + "'");
                }
            }
        }
        if (rule.getSummaryTemplate() != null) {
            try {
                Templates.placeholders(rule.getSummaryTemplate());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Rule '" + context + "' has a malformed summary_template: "
                        + e.getMessage(), e);
            }
        }
    }
}

package com.resource.naming.rules;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Effective naming rule for one resource type (or the default rule).
 * Instances are immutable and shared across requests.
 */
public class NamingRule {

    private static final List<String> SUMMARY_CASE_KEYS =
            List.of("environment", "region", "system", RuleFields.RESOURCE_TYPE);

    private final List<String> segments;
    private final int maxLength;
    private final boolean requireOrgPrefix;
    private final String nameTemplate;
    private final String summaryTemplate;
    private final List<DisplayField> displayFields;
    private final List<PayloadValidator> validators;

    private NamingRule(Builder builder) {
        this.segments = List.copyOf(builder.segments);
        this.maxLength = builder.maxLength;
        this.requireOrgPrefix = builder.requireOrgPrefix;
        this.nameTemplate = builder.nameTemplate;
        this.summaryTemplate = builder.summaryTemplate;
        this.displayFields = List.copyOf(builder.displayFields);
        this.validators = List.copyOf(builder.validators);
    }

    public List<String> getSegments() {
        return segments;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public boolean isRequireOrgPrefix() {
        return requireOrgPrefix;
    }

    public String getNameTemplate() {
        return nameTemplate;
    }

    public String getSummaryTemplate() {
        return summaryTemplate;
    }

    public List<DisplayField> getDisplayFields() {
        return displayFields;
    }

    public List<PayloadValidator> getValidators() {
        return validators;
    }

    public boolean hasTemplate() {
        return nameTemplate != null && !nameTemplate.isBlank();
    }

    /**
     * Fields that feed name assembly: the template placeholders when a template is set,
     * otherwise the segment list. {@code x_segment} placeholders count as {@code x}.
     */
    public Set<String> assemblyFields() {
        Set<String> fields = new LinkedHashSet<>();
        List<String> source = hasTemplate() ? Templates.placeholders(nameTemplate) : segments;
        for (String field : source) {
            fields.add(RuleFields.isSegmentVariant(field) ? RuleFields.variantOf(field) : field);
        }
        return fields;
    }

    public boolean usesField(String field) {
        return assemblyFields().contains(field);
    }

    /**
     * Runs every declarative validator against the payload.
     *
     * @throws com.resource.naming.error.ValidationException on the first violation
     */
    public void validatePayload(Map<String, String> payload) {
        for (PayloadValidator validator : validators) {
            validator.validate(payload);
        }
    }

    /**
     * Ordered display entries for a response. Optional fields without a value are skipped.
     */
    public List<DisplayValue> renderDisplay(Map<String, String> payload) {
        List<DisplayValue> rendered = new ArrayList<>();
        for (DisplayField field : displayFields) {
            String value = payload.get(field.key());
            if (value == null && field.optional()) {
                continue;
            }
            rendered.add(new DisplayValue(field.key(), field.label(), value, field.description()));
        }
        return rendered;
    }

    /**
     * Renders the summary template, or returns null when none is configured.
     * Supports {@code {key_upper}} and {@code {key_title}} for environment, region, system and resourceType.
     * Unknown placeholders render empty.
     */
    public String renderSummary(Map<String, String> payload) {
        if (summaryTemplate == null || summaryTemplate.isBlank()) {
            return null;
        }
        Map<String, String> context = new HashMap<>(payload);
        for (String key : SUMMARY_CASE_KEYS) {
            String value = context.getOrDefault(key, "");
            context.put(key + "_upper", value.toUpperCase(Locale.ROOT));
            context.put(key + "_title", DisplayField.titleCase(value));
        }
        return Templates.render(summaryTemplate, name -> context.getOrDefault(name, ""));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NamingRule that = (NamingRule) o;
        return maxLength == that.maxLength
                && requireOrgPrefix == that.requireOrgPrefix
                && segments.equals(that.segments)
                && Objects.equals(nameTemplate, that.nameTemplate)
                && Objects.equals(summaryTemplate, that.summaryTemplate)
                && displayFields.equals(that.displayFields)
                && validators.equals(that.validators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments, maxLength, requireOrgPrefix, nameTemplate, summaryTemplate);
    }

    @Override
    public String toString() {
        return "NamingRule{" +
                "segments=" + segments +
                ", maxLength=" + maxLength +
                ", requireOrgPrefix=" + requireOrgPrefix +
                ", nameTemplate='" + nameTemplate + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> segments = List.of();
        private int maxLength = 80;
        private boolean requireOrgPrefix;
        private String nameTemplate;
        private String summaryTemplate;
        private List<DisplayField> displayFields = List.of();
        private List<PayloadValidator> validators = List.of();

        public Builder segments(List<String> segments) {
            this.segments = segments;
            return this;
        }

        public Builder segments(String... segments) {
            this.segments = List.of(segments);
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder requireOrgPrefix(boolean requireOrgPrefix) {
            this.requireOrgPrefix = requireOrgPrefix;
            return this;
        }

        public Builder nameTemplate(String nameTemplate) {
            this.nameTemplate = nameTemplate;
            return this;
        }

        public Builder summaryTemplate(String summaryTemplate) {
            this.summaryTemplate = summaryTemplate;
            return this;
        }

        public Builder displayFields(List<DisplayField> displayFields) {
            this.displayFields = displayFields;
            return this;
        }

        public Builder validators(List<PayloadValidator> validators) {
            this.validators = validators;
            return this;
        }

        public NamingRule build() {
            Objects.requireNonNull(segments, "segments is required");
            if (maxLength < 1) {
                throw new IllegalArgumentException("maxLength must be at least 1");
            }
            return new NamingRule(this);
        }
    }
}

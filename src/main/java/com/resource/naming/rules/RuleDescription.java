package com.resource.naming.rules;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of an effective rule for discovery endpoints.
 */
public record RuleDescription(
        String resourceType,
        int maxLength,
        boolean requirePrefix,
        List<String> segments,
        List<String> optionalSegments,
        List<DisplayField> displayFields,
        String nameTemplate,
        String summaryTemplate,
        List<TemplateField> templateFields,
        Map<String, String> segmentMappings,
        PayloadInputs payloadInputs,
        List<String> validators
) {

    /**
     * A placeholder of the name template.
     *
     * @param type {@code coreInput}, {@code optionalSegment} or {@code context}
     * @param variantOf base field of an {@code x_segment} placeholder, otherwise null
     */
    public record TemplateField(String name, String type, String variantOf) {
    }

    public record PayloadInputs(List<String> required, List<String> optional) {
    }
}

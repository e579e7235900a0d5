package com.resource.naming.rules;

import java.util.List;
import java.util.Set;

/**
 * Field vocabulary that segments and name templates may reference.
 */
public final class RuleFields {

    public static final String SLUG = "slug";
    public static final String REGION = "region";
    public static final String ENVIRONMENT = "environment";
    public static final String ORG_PREFIX = "org_prefix";
    public static final String INDEX = "index";
    public static final String RESOURCE_TYPE = "resourceType";

    /** Suffix of the optional variant of a placeholder, rendered as {@code -value} or nothing. */
    public static final String SEGMENT_SUFFIX = "_segment";

    /** Inputs every claim must carry. */
    public static final Set<String> CORE_INPUTS = Set.of(SLUG, REGION, ENVIRONMENT);

    /** Caller-supplied segments, in the order they are documented to callers. */
    public static final List<String> OPTIONAL_SEGMENTS = List.of(
            "system", "system_short", "subsystem", "domain", "subdomain", "project", "purpose", INDEX);

    private RuleFields() {
    }

    public static boolean isCoreInput(String field) {
        return CORE_INPUTS.contains(field);
    }

    public static boolean isOptionalSegment(String field) {
        return OPTIONAL_SEGMENTS.contains(field);
    }

    public static boolean isSegmentVariant(String field) {
        return field.endsWith(SEGMENT_SUFFIX)
                && isOptionalSegment(variantOf(field));
    }

    /**
     * Returns the base field of a {@code x_segment} placeholder.
     */
    public static String variantOf(String field) {
        return field.substring(0, field.length() - SEGMENT_SUFFIX.length());
    }

    /**
     * Returns true if a segment list entry or name template placeholder may reference the field.
     */
    public static boolean isKnown(String field) {
        return isCoreInput(field)
                || ORG_PREFIX.equals(field)
                || isOptionalSegment(field)
                || isSegmentVariant(field);
    }
}

package com.resource.naming.builder;

import com.resource.naming.error.ValidationException;
import com.resource.naming.rules.NamingRule;
import com.resource.naming.rules.RuleFields;
import com.resource.naming.rules.Templates;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Assembles a candidate name from a rule and resolved segment values.
 *
 * <p>With a name template, placeholders are substituted; {@code {x_segment}} renders as
 * {@code -x} or nothing, {@code {org_prefix}} renders the organization marker when the rule
 * requires it. Any other placeholder without a value is rejected. Without a template the
 * rule's segments are joined with {@code -}, skipping optional segments that have no value.</p>
 *
 * <p>The result is lowercase and must consist of {@code [a-z0-9-]} only and fit the rule's
 * maximum length. Nothing is ever truncated or substituted. A caller value may contain
 * {@code -} but never as its first or last character or twice in a row, on either path;
 * only separators left around an omitted template part are collapsed.</p>
 */
public class NameBuilder {

    public static final String DEFAULT_ORG_PREFIX = "org";
    public static final String SEPARATOR = "-";

    private static final Pattern VALID_NAME = Pattern.compile("^[a-z0-9-]+$");
    private static final Pattern REPEATED_SEPARATOR = Pattern.compile("-{2,}");
    private static final String EMPTY_PART = SEPARATOR + SEPARATOR;

    private final String orgPrefix;

    public NameBuilder() {
        this(DEFAULT_ORG_PREFIX);
    }

    public NameBuilder(String orgPrefix) {
        if (orgPrefix == null || !VALID_NAME.matcher(orgPrefix).matches() || orgPrefix.contains(SEPARATOR)) {
            throw new IllegalArgumentException("orgPrefix must be lowercase letters and digits");
        }
        this.orgPrefix = orgPrefix;
    }

    public String getOrgPrefix() {
        return orgPrefix;
    }

    /**
     * @param rule             effective rule for the resource type
     * @param resolvedSegments values keyed by field name: slug, region, environment and optional segments
     * @return the lowercase candidate name
     * @throws ValidationException if a value is missing or has an empty part between separators,
     *                             a character is invalid or the name is too long
     */
    public String build(NamingRule rule, Map<String, String> resolvedSegments) {
        String assembled = rule.hasTemplate()
                ? fromTemplate(rule, resolvedSegments)
                : fromSegments(rule, resolvedSegments);
        String name = assembled.toLowerCase(Locale.ROOT);
        validate(name, rule.getMaxLength());
        return name;
    }

    private String fromTemplate(NamingRule rule, Map<String, String> values) {
        String template = rule.getNameTemplate();
        String rendered = Templates.render(template, placeholder -> {
            if (RuleFields.ORG_PREFIX.equals(placeholder)) {
                return rule.isRequireOrgPrefix() ? orgPrefix : "";
            }
            if (RuleFields.isSegmentVariant(placeholder)) {
                String value = valueOf(values, RuleFields.variantOf(placeholder));
                return value != null ? SEPARATOR + value : "";
            }
            String value = valueOf(values, placeholder);
            if (value == null) {
                throw new ValidationException("Missing value for placeholder '" + placeholder + "'");
            }
            return value;
        });
        String name = trimSeparators(REPEATED_SEPARATOR.matcher(rendered).replaceAll(SEPARATOR));
        boolean placesPrefix = template.contains("{" + RuleFields.ORG_PREFIX + "}");
        if (rule.isRequireOrgPrefix() && !placesPrefix) {
            return withPrefix(name);
        }
        return name;
    }

    private String fromSegments(NamingRule rule, Map<String, String> values) {
        List<String> parts = new ArrayList<>();
        for (String segment : rule.getSegments()) {
            if (RuleFields.ORG_PREFIX.equals(segment)) {
                continue;
            }
            String value = valueOf(values, segment);
            if (value == null) {
                if (RuleFields.isCoreInput(segment)) {
                    throw new ValidationException("Missing value for segment '" + segment + "'");
                }
                continue;
            }
            parts.add(value);
        }
        String name = String.join(SEPARATOR, parts);
        return rule.isRequireOrgPrefix() ? withPrefix(name) : name;
    }

    private String withPrefix(String name) {
        if (name.toLowerCase(Locale.ROOT).startsWith(orgPrefix + SEPARATOR)) {
            return name;
        }
        return name.isEmpty() ? orgPrefix : orgPrefix + SEPARATOR + name;
    }

    private static String valueOf(Map<String, String> values, String key) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.startsWith(SEPARATOR) || trimmed.endsWith(SEPARATOR) || trimmed.contains(EMPTY_PART)) {
            throw new ValidationException("Value '" + trimmed + "' for '" + key
                    + "' has an empty part. Hyphens may only appear between letters or digits.");
        }
        return trimmed;
    }

    private static String trimSeparators(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * Checks charset and length of an assembled name.
     *
     * @throws ValidationException with the offending characters or the length overrun
     */
    public static void validate(String name, int maxLength) {
        if (name.isEmpty()) {
            throw new ValidationException("Assembled name is empty");
        }
        if (!VALID_NAME.matcher(name).matches()) {
            Set<String> invalid = new TreeSet<>();
            name.codePoints()
                    .filter(cp -> !(cp >= 'a' && cp <= 'z') && !(cp >= '0' && cp <= '9') && cp != '-')
                    .forEach(cp -> invalid.add(describe(cp)));
            throw new ValidationException("Name contains invalid characters: " + String.join(", ", invalid)
                    + ". Only lowercase letters (a-z), numbers (0-9), and hyphens (-) are allowed.");
        }
        if (name.length() > maxLength) {
            int excess = name.length() - maxLength;
            throw new ValidationException("Name '" + name + "' exceeds character limit. Length: " + name.length()
                    + " characters, Limit: " + maxLength + " characters, Over by: " + excess
                    + " character" + (excess != 1 ? "s" : "") + ".");
        }
    }

    private static String describe(int codePoint) {
        if (Character.isISOControl(codePoint) || Character.isWhitespace(codePoint)) {
            return String.format("U+%04X", codePoint);
        }
        return new String(Character.toChars(codePoint));
    }
}

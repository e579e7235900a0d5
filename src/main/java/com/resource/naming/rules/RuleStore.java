package com.resource.naming.rules;

import com.resource.naming.error.ConfigurationException;
import com.resource.naming.error.NotFoundException;
import com.resource.naming.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the effective rule table built from layered rule definitions.
 *
 * <p>Layers merge in ascending priority (ties broken by source name); disabled layers are skipped.
 * Default fragments merge first and form the base of every resource type. A resource fragment
 * merges onto that type's rule from lower layers, or onto the default rule.</p>
 *
 * <p>Each load builds a complete {@link EffectiveRuleTable} and swaps it in with a single
 * reference write. A failed load leaves the current generation untouched.</p>
 */
public class RuleStore {
    private static final Logger log = LoggerFactory.getLogger(RuleStore.class);

    static final Set<String> DEFAULT_KEYS = Set.of("default", "__default__");
    private static final int MAX_RESOURCE_TYPE_LENGTH = 128;

    private static final Comparator<RuleLayer> MERGE_ORDER =
            Comparator.comparingInt(RuleLayer::priority).thenComparing(RuleLayer::source);

    private final RuleSource source;
    private final AtomicLong generations = new AtomicLong();
    private final AtomicReference<EffectiveRuleTable> table = new AtomicReference<>(EffectiveRuleTable.empty());

    /**
     * Creates an empty store; call {@link #loadRules(List)} before use.
     */
    public RuleStore() {
        this.source = null;
    }

    /**
     * Creates a store and loads it from the source.
     *
     * @throws ConfigurationException if the initial load fails
     */
    public RuleStore(RuleSource source) {
        this.source = source;
        reload();
    }

    /**
     * Merges the layers into a new generation and makes it current.
     *
     * @throws ConfigurationException if a layer is malformed or no enabled layer exists
     */
    public EffectiveRuleTable loadRules(List<RuleLayer> layers) {
        EffectiveRuleTable merged = merge(layers, generations.incrementAndGet());
        table.set(merged);
        log.info("rules.loaded generation={} layers={} resourceTypes={} hasDefault={}",
                merged.generation(), merged.layers(), merged.rules().size(), merged.defaultRule() != null);
        return merged;
    }

    /**
     * Re-reads layers from the configured source.
     *
     * @throws IllegalStateException if the store was created without a source
     */
    public EffectiveRuleTable reload() {
        if (source == null) {
            throw new IllegalStateException("RuleStore has no RuleSource to reload from");
        }
        try {
            return loadRules(source.load());
        } catch (ConfigurationException e) {
            log.error("rules.load.failed source={} error={}", source.describe(), e.getMessage());
            throw e;
        }
    }

    static EffectiveRuleTable merge(List<RuleLayer> layers, long generation) {
        List<RuleLayer> enabled = layers.stream()
                .filter(RuleLayer::enabled)
                .sorted(MERGE_ORDER)
                .toList();
        if (enabled.isEmpty()) {
            throw new ConfigurationException("No enabled rule layers found");
        }

        NamingRule defaultRule = null;
        Map<String, NamingRule> rules = new HashMap<>();
        List<String> names = new ArrayList<>();

        for (RuleLayer layer : enabled) {
            names.add(layer.name());
            if (layer.defaultRule() != null) {
                defaultRule = layer.defaultRule().mergeOnto(defaultRule, layer.name() + ":default");
            }
            for (Map.Entry<String, RuleFragment> entry : layer.resources().entrySet()) {
                NamingRule base = rules.getOrDefault(entry.getKey(), defaultRule);
                rules.put(entry.getKey(), entry.getValue().mergeOnto(base, layer.name() + ":" + entry.getKey()));
            }
        }
        return new EffectiveRuleTable(generation, defaultRule, rules, names, Instant.now());
    }

    /**
     * Returns the rule for a resource type, falling back to the default rule.
     *
     * @throws NotFoundException if neither exists
     */
    public NamingRule getRule(String resourceType) {
        String key = normalizeType(resourceType);
        return table.get().find(key)
                .orElseThrow(() -> new NotFoundException("No naming rule for resource type '" + resourceType.trim() + "'"));
    }

    /**
     * Describes the effective rule for discovery endpoints.
     *
     * @throws NotFoundException if no rule applies
     */
    public RuleDescription describeRule(String resourceType) {
        String key = normalizeType(resourceType);
        NamingRule rule = getRule(key);

        List<String> optionalSegments = rule.getSegments().stream()
                .filter(s -> !RuleFields.isCoreInput(s) && !RuleFields.ORG_PREFIX.equals(s))
                .toList();

        List<RuleDescription.TemplateField> templateFields = new ArrayList<>();
        if (rule.hasTemplate()) {
            for (String placeholder : Templates.placeholders(rule.getNameTemplate())) {
                if (RuleFields.isSegmentVariant(placeholder)) {
                    templateFields.add(new RuleDescription.TemplateField(placeholder, "optionalSegment",
                            RuleFields.variantOf(placeholder)));
                } else if (RuleFields.isCoreInput(placeholder)) {
                    templateFields.add(new RuleDescription.TemplateField(placeholder, "coreInput", null));
                } else {
                    templateFields.add(new RuleDescription.TemplateField(placeholder, "context", null));
                }
            }
        }

        Map<String, String> segmentMappings = new LinkedHashMap<>();
        List<String> optionalInputs = new ArrayList<>();
        for (String field : rule.assemblyFields()) {
            switch (field) {
                case RuleFields.SLUG -> segmentMappings.put(field, RuleFields.RESOURCE_TYPE);
                case RuleFields.ORG_PREFIX -> segmentMappings.put(field, "requirePrefix");
                default -> {
                    segmentMappings.put(field, field);
                    if (RuleFields.isOptionalSegment(field)) {
                        optionalInputs.add(field);
                    }
                }
            }
        }

        return new RuleDescription(
                key,
                rule.getMaxLength(),
                rule.isRequireOrgPrefix(),
                rule.getSegments(),
                optionalSegments,
                rule.getDisplayFields(),
                rule.getNameTemplate(),
                rule.getSummaryTemplate(),
                templateFields,
                segmentMappings,
                new RuleDescription.PayloadInputs(
                        List.of(RuleFields.RESOURCE_TYPE, RuleFields.REGION, RuleFields.ENVIRONMENT),
                        optionalInputs),
                rule.getValidators().stream().map(PayloadValidator::type).toList()
        );
    }

    /**
     * Sorted explicit resource types, plus {@code default} when a default rule exists.
     */
    public List<String> listResourceTypes() {
        EffectiveRuleTable current = table.get();
        Set<String> types = new TreeSet<>(current.rules().keySet());
        if (current.defaultRule() != null) {
            types.add("default");
        }
        return List.copyOf(types);
    }

    public EffectiveRuleTable current() {
        return table.get();
    }

    public boolean isReady() {
        return !table.get().isEmpty();
    }

    public String sourceDescription() {
        return source != null ? source.describe() : "programmatic";
    }

    /**
     * Lowercases, trims and turns whitespace runs into underscores.
     *
     * @throws ValidationException for blank or overlong input
     */
    public static String normalizeType(String resourceType) {
        if (resourceType == null || resourceType.isBlank()) {
            throw new ValidationException("resourceType is required");
        }
        String trimmed = resourceType.trim();
        if (trimmed.length() > MAX_RESOURCE_TYPE_LENGTH) {
            throw new ValidationException("resourceType must be at most " + MAX_RESOURCE_TYPE_LENGTH + " characters");
        }
        return trimmed.toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }
}

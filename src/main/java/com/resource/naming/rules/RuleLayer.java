package com.resource.naming.rules;

import com.resource.naming.error.ConfigurationException;
import com.resource.naming.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named, prioritized overlay of naming policy.
 *
 * @param name        layer name from its metadata
 * @param priority    merge order; higher priorities override lower ones
 * @param enabled     disabled layers are skipped entirely
 * @param source      where the layer was read from, used as the tie-breaker for equal priorities
 * @param defaultRule fragment applied to the default rule, may be null
 * @param resources   per resource type fragments, keyed by normalized resource type
 */
public record RuleLayer(
        String name,
        int priority,
        boolean enabled,
        String source,
        RuleFragment defaultRule,
        Map<String, RuleFragment> resources
) {
    public RuleLayer {
        Objects.requireNonNull(name, "name is required");
        source = source != null ? source : name;
        String origin = source;
        Map<String, RuleFragment> normalized = new LinkedHashMap<>();
        if (resources != null) {
            resources.forEach((type, fragment) -> {
                try {
                    normalized.put(RuleStore.normalizeType(type), fragment);
                } catch (ValidationException e) {
                    throw new ConfigurationException("Rule layer '" + origin + "' has an invalid resource type key", e);
                }
            });
        }
        resources = Map.copyOf(normalized);
    }
}

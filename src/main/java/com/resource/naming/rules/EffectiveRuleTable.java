package com.resource.naming.rules;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable result of merging rule layers. A new generation replaces the previous one as a whole.
 *
 * @param generation  monotonically increasing load number
 * @param defaultRule merged default rule, or null when no layer defines one
 * @param rules       explicit per-type rules keyed by normalized resource type
 * @param layers      names of the merged layers, in merge order
 * @param loadedAt    when this generation was built
 */
public record EffectiveRuleTable(
        long generation,
        NamingRule defaultRule,
        Map<String, NamingRule> rules,
        List<String> layers,
        Instant loadedAt
) {
    public EffectiveRuleTable {
        rules = rules != null ? Map.copyOf(rules) : Map.of();
        layers = layers != null ? List.copyOf(layers) : List.of();
        loadedAt = loadedAt != null ? loadedAt : Instant.now();
    }

    static EffectiveRuleTable empty() {
        return new EffectiveRuleTable(0, null, Map.of(), List.of(), Instant.EPOCH);
    }

    public Optional<NamingRule> find(String normalizedType) {
        if (RuleStore.DEFAULT_KEYS.contains(normalizedType)) {
            return Optional.ofNullable(defaultRule);
        }
        NamingRule rule = rules.get(normalizedType);
        return Optional.ofNullable(rule != null ? rule : defaultRule);
    }

    public boolean isEmpty() {
        return defaultRule == null && rules.isEmpty();
    }
}

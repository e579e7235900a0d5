package com.resource.naming.health;

import com.resource.naming.rules.EffectiveRuleTable;
import com.resource.naming.rules.RuleStore;

/**
 * DOWN until a rule table has been loaded.
 */
public class RuleStoreHealthCheck implements HealthCheck {

    private final RuleStore ruleStore;

    public RuleStoreHealthCheck(RuleStore ruleStore) {
        this.ruleStore = ruleStore;
    }

    @Override
    public String getName() {
        return "rules";
    }

    @Override
    public HealthStatus check() {
        if (!ruleStore.isReady()) {
            return HealthStatus.down("No rule table loaded");
        }
        EffectiveRuleTable table = ruleStore.current();
        return HealthStatus.up()
                .withDetail("generation", table.generation())
                .withDetail("resourceTypes", table.rules().size())
                .withDetail("layers", table.layers())
                .withDetail("loadedAt", String.valueOf(table.loadedAt()));
    }
}

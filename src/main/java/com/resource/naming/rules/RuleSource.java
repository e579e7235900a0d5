package com.resource.naming.rules;

import java.util.List;

/**
 * Supplies rule layers to a {@link RuleStore}, at start-up and on reload.
 */
public interface RuleSource {

    /**
     * @throws com.resource.naming.error.ConfigurationException if layers cannot be read or parsed
     */
    List<RuleLayer> load();

    /**
     * Human-readable location, for logs and health details.
     */
    String describe();
}

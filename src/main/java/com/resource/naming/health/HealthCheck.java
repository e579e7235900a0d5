package com.resource.naming.health;

/**
 * A single component check contributing to service health.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();

    /**
     * A failing non-critical check degrades the service instead of taking it down.
     */
    default boolean isCritical() {
        return true;
    }
}

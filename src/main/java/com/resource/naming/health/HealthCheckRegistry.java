package com.resource.naming.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered checks and reports the worst status among them.
 * A check that throws counts as DOWN. A non-critical check contributes at most DEGRADED.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));
            HealthStatus.Status effective = result.isDown() && !check.isCritical()
                    ? HealthStatus.Status.DEGRADED
                    : result.status();
            if (effective.ordinal() > worst.ordinal()) {
                worst = effective;
                worstMessage = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, worstMessage, results);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("check failed").withDetail("error", e.getClass().getSimpleName());
        }
    }
}

package com.resource.naming.health;

import com.resource.naming.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FalkorDB connectivity with round-trip latency. Connection detail goes to the log only.
 */
public class FalkorDBHealthCheck implements HealthCheck {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBHealthCheck.class);

    private final GraphConnection connection;

    public FalkorDBHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "falkordb";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            connection.query("RETURN 1");
            long latencyMs = System.currentTimeMillis() - startMs;
            return HealthStatus.up()
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("graphName", connection.getGraphName());
        } catch (Exception e) {
            log.warn("health.falkordb.down error={}", e.getMessage());
            return HealthStatus.down("FalkorDB connection failed")
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}

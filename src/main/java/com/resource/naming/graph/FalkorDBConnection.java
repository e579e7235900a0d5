package com.resource.naming.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-specific implementation using the JFalkorDB client.
 * Parameters are bound through {@link CypherLiterals}.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String boundQuery = CypherLiterals.bind(query, params);
        log.debug("Executing: {}", query);
        graph.query(boundQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String boundQuery = CypherLiterals.bind(query, params);
        log.debug("Querying: {}", query);

        ResultSet resultSet = graph.query(boundQuery);
        List<Map<String, Object>> results = new ArrayList<>();

        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating indexes for resource naming...");

        safeExecute("CREATE INDEX FOR (c:ClaimedName) ON (c.partition)");
        safeExecute("CREATE INDEX FOR (c:ClaimedName) ON (c.name)");

        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.name)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.actor)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.timestamp)");

        safeExecute("CREATE INDEX FOR (s:SlugMapping) ON (s.resourceType)");
        safeExecute("CREATE INDEX FOR (s:SlugMapping) ON (s.fullName)");

        log.info("Index creation complete");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // Index might already exist
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed");
    }
}

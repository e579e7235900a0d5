package com.resource.naming.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resource.naming.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed implementation of AuditRepository.
 * Persists AuditEntry as :AuditEntry nodes in the graph database.
 * Metadata maps are serialized as JSON strings; timestamps are kept both as ISO text
 * and epoch milliseconds so range filters compare numerically.
 */
public class GraphAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphAuditRepository.class);
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private static final String RETURN_COLUMNS = """
            RETURN a.id as id, a.action as action, a.name as name, a.actor as actor,
                   a.region as region, a.environment as environment, a.note as note,
                   a.metadata as metadata, a.timestamp as timestamp
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphAuditRepository(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = new ObjectMapper();
        createIndexes();
    }

    private void createIndexes() {
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.name)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.actor)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.timestampMs)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        String query = """
                CREATE (a:AuditEntry {
                    id: $id,
                    action: $action,
                    name: $name,
                    actor: $actor,
                    region: $region,
                    environment: $environment,
                    note: $note,
                    metadata: $metadata,
                    timestamp: $timestamp,
                    timestampMs: $timestampMs
                })
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("id", entry.id());
        params.put("action", entry.action().name());
        params.put("name", entry.name());
        params.put("actor", entry.actor());
        params.put("region", entry.region() != null ? entry.region() : "");
        params.put("environment", entry.environment() != null ? entry.environment() : "");
        params.put("note", entry.note() != null ? entry.note() : "");
        params.put("metadata", serializeMetadata(entry.metadata()));
        params.put("timestamp", entry.timestamp().toString());
        params.put("timestampMs", entry.timestamp().toEpochMilli());
        connection.execute(query, params);
        log.debug("audit.persisted action={} name={}", entry.action(), entry.name());
        return entry;
    }

    @Override
    public List<AuditEntry> findByName(String region, String environment, String name) {
        String query = """
                MATCH (a:AuditEntry)
                WHERE a.name = $name AND a.region = $region AND a.environment = $environment
                """ + RETURN_COLUMNS + """
                ORDER BY a.timestampMs ASC
                """;
        return mapResults(connection.query(query, Map.of(
                "name", name,
                "region", region,
                "environment", environment
        )));
    }

    @Override
    public List<AuditEntry> query(AuditQuery filter) {
        List<String> conditions = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        if (filter.actor() != null) {
            conditions.add("toLower(a.actor) = $actor");
            params.put("actor", filter.actor());
        }
        if (filter.region() != null) {
            conditions.add("a.region = $region");
            params.put("region", filter.region());
        }
        if (filter.environment() != null) {
            conditions.add("a.environment = $environment");
            params.put("environment", filter.environment());
        }
        if (filter.action() != null) {
            conditions.add("a.action = $action");
            params.put("action", filter.action().name());
        }
        if (filter.start() != null) {
            conditions.add("a.timestampMs >= $start");
            params.put("start", filter.start().toEpochMilli());
        }
        if (filter.end() != null) {
            conditions.add("a.timestampMs <= $end");
            params.put("end", filter.end().toEpochMilli());
        }
        String where = conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions) + "\n";
        String query = "MATCH (a:AuditEntry)\n" + where + RETURN_COLUMNS + "ORDER BY a.timestampMs DESC\n";
        return mapResults(connection.query(query, params));
    }

    @Override
    public int count() {
        List<Map<String, Object>> results = connection.query("MATCH (a:AuditEntry) RETURN count(a) as cnt");
        if (results.isEmpty()) {
            return 0;
        }
        Object cnt = results.get(0).get("cnt");
        return cnt instanceof Number number ? number.intValue() : 0;
    }

    private List<AuditEntry> mapResults(List<Map<String, Object>> results) {
        List<AuditEntry> entries = new ArrayList<>(results.size());
        for (Map<String, Object> row : results) {
            entries.add(mapRow(row));
        }
        return entries;
    }

    private AuditEntry mapRow(Map<String, Object> row) {
        return AuditEntry.builder()
                .id(text(row.get("id")))
                .action(AuditAction.valueOf(text(row.get("action"))))
                .name(text(row.get("name")))
                .actor(text(row.get("actor")))
                .region(emptyToNull(text(row.get("region"))))
                .environment(emptyToNull(text(row.get("environment"))))
                .note(emptyToNull(text(row.get("note"))))
                .metadata(deserializeMetadata(text(row.get("metadata"))))
                .timestamp(Instant.parse(text(row.get("timestamp"))))
                .build();
    }

    private String serializeMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("audit.metadata.serialize.failed error={}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, String> deserializeMetadata(String json) {
        if (json == null || json.isEmpty() || "{}".equals(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("audit.metadata.deserialize.failed error={}", e.getMessage());
            return Map.of();
        }
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}

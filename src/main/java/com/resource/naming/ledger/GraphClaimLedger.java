package com.resource.naming.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resource.naming.audit.AuditEntry;
import com.resource.naming.audit.AuditQuery;
import com.resource.naming.audit.AuditRepository;
import com.resource.naming.audit.GraphAuditRepository;
import com.resource.naming.core.model.ClaimKey;
import com.resource.naming.core.model.ClaimedName;
import com.resource.naming.core.model.VersionToken;
import com.resource.naming.core.model.VersionedClaim;
import com.resource.naming.error.ConflictException;
import com.resource.naming.error.NotFoundException;
import com.resource.naming.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * FalkorDB-backed implementation of ClaimLedger.
 * Persists claims as :ClaimedName nodes keyed by (partition, name).
 * <p>
 * Create is a single {@code MERGE ... ON CREATE SET} carrying a per-call token: the caller
 * created the row only when the token read back is its own. Replace is a single
 * {@code MATCH ... WHERE c.version = $expected SET ...}; an empty result means the row
 * is gone or was modified since it was read.
 */
public class GraphClaimLedger implements ClaimLedger {
    private static final Logger log = LoggerFactory.getLogger(GraphClaimLedger.class);
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private static final String ASSIGNMENTS = """
            c.region = $region, c.environment = $environment,
            c.resourceType = $resourceType, c.slug = $slug, c.inUse = $inUse,
            c.claimedBy = $claimedBy, c.claimedAt = $claimedAt,
            c.releasedBy = $releasedBy, c.releasedAt = $releasedAt, c.releaseReason = $releaseReason,
            c.segments = $segments, c.metadata = $metadata""";

    private final GraphConnection connection;
    private final AuditRepository auditRepository;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GraphClaimLedger(GraphConnection connection) {
        this(connection, new GraphAuditRepository(connection));
    }

    public GraphClaimLedger(GraphConnection connection, AuditRepository auditRepository) {
        this.connection = connection;
        this.auditRepository = auditRepository;
        createIndexes();
    }

    private void createIndexes() {
        safeExecute("CREATE INDEX FOR (c:ClaimedName) ON (c.partition)");
        safeExecute("CREATE INDEX FOR (c:ClaimedName) ON (c.name)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public VersionToken createIfAbsent(ClaimKey key, ClaimedName record) {
        String token = UUID.randomUUID().toString();
        String query = """
                MERGE (c:ClaimedName {partition: $partition, name: $name})
                ON CREATE SET c.createToken = $token, c.version = 1,
                """ + ASSIGNMENTS + """

                RETURN c.createToken as token, c.version as version
                """;
        Map<String, Object> params = recordParams(key, record);
        params.put("token", token);

        List<Map<String, Object>> rows = connection.query(query, params);
        if (rows.isEmpty() || !token.equals(rows.get(0).get("token"))) {
            throw new ConflictException("Name '" + key.name() + "' already exists in " + key.partition());
        }
        VersionToken version = versionOf(rows.get(0).get("version"));
        log.debug("ledger.created key={} version={}", key, version);
        return version;
    }

    @Override
    public VersionToken replaceIfUnchanged(ClaimKey key, ClaimedName record, VersionToken expected) {
        long expectedVersion;
        try {
            expectedVersion = Long.parseLong(expected.value());
        } catch (NumberFormatException e) {
            get(key);
            throw new ConflictException("Name '" + key.name() + "' was modified concurrently");
        }
        String query = """
                MATCH (c:ClaimedName {partition: $partition, name: $name})
                WHERE c.version = $expected
                SET c.version = c.version + 1,
                """ + ASSIGNMENTS + """

                RETURN c.version as version
                """;
        Map<String, Object> params = recordParams(key, record);
        params.put("expected", expectedVersion);

        List<Map<String, Object>> rows = connection.query(query, params);
        if (rows.isEmpty()) {
            // distinguishes a missing row from a stale version
            get(key);
            throw new ConflictException("Name '" + key.name() + "' was modified concurrently");
        }
        VersionToken version = versionOf(rows.get(0).get("version"));
        log.debug("ledger.replaced key={} version={}", key, version);
        return version;
    }

    @Override
    public VersionedClaim get(ClaimKey key) {
        String query = """
                MATCH (c:ClaimedName {partition: $partition, name: $name})
                RETURN c.name as name, c.region as region, c.environment as environment,
                       c.resourceType as resourceType, c.slug as slug, c.inUse as inUse,
                       c.claimedBy as claimedBy, c.claimedAt as claimedAt,
                       c.releasedBy as releasedBy, c.releasedAt as releasedAt,
                       c.releaseReason as releaseReason, c.segments as segments,
                       c.metadata as metadata, c.version as version
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "partition", key.partition(),
                "name", key.name()
        ));
        if (rows.isEmpty()) {
            throw new NotFoundException("Name '" + key.name() + "' not found in " + key.partition());
        }
        Map<String, Object> row = rows.get(0);
        ClaimedName claim = ClaimedName.builder()
                .name(text(row.get("name")))
                .region(text(row.get("region")))
                .environment(text(row.get("environment")))
                .resourceType(text(row.get("resourceType")))
                .slug(text(row.get("slug")))
                .inUse(Boolean.TRUE.equals(row.get("inUse")))
                .claimedBy(text(row.get("claimedBy")))
                .claimedAt(instant(row.get("claimedAt")))
                .releasedBy(text(row.get("releasedBy")))
                .releasedAt(instant(row.get("releasedAt")))
                .releaseReason(text(row.get("releaseReason")))
                .segments(readMap(text(row.get("segments"))))
                .metadata(readMap(text(row.get("metadata"))))
                .build();
        return new VersionedClaim(claim, versionOf(row.get("version")));
    }

    @Override
    public void appendAudit(AuditEntry entry) {
        auditRepository.save(entry);
    }

    @Override
    public List<AuditEntry> auditTrail(ClaimKey key) {
        return auditRepository.findByName(key.region(), key.environment(), key.name());
    }

    @Override
    public List<AuditEntry> queryAudit(AuditQuery query) {
        return auditRepository.query(query);
    }

    @Override
    public boolean isAvailable() {
        return connection.isConnected();
    }

    private Map<String, Object> recordParams(ClaimKey key, ClaimedName record) {
        Map<String, Object> params = new HashMap<>();
        params.put("partition", key.partition());
        params.put("name", key.name());
        params.put("region", key.region());
        params.put("environment", key.environment());
        params.put("resourceType", record.resourceType());
        params.put("slug", record.slug());
        params.put("inUse", record.inUse());
        params.put("claimedBy", record.claimedBy());
        params.put("claimedAt", record.claimedAt().toString());
        params.put("releasedBy", record.releasedBy());
        params.put("releasedAt", record.releasedAt() != null ? record.releasedAt().toString() : null);
        params.put("releaseReason", record.releaseReason());
        params.put("segments", writeMap(record.segments()));
        params.put("metadata", writeMap(record.metadata()));
        return params;
    }

    private String writeMap(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize string map", e);
        }
    }

    private Map<String, String> readMap(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, STRING_MAP);
        } catch (JsonProcessingException e) {
            log.warn("ledger.map.deserialize.failed error={}", e.getMessage());
            return Map.of();
        }
    }

    private static VersionToken versionOf(Object value) {
        if (value instanceof Number number) {
            return VersionToken.of(number.longValue());
        }
        return VersionToken.of(String.valueOf(value));
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Instant instant(Object value) {
        return value != null ? Instant.parse(value.toString()) : null;
    }
}

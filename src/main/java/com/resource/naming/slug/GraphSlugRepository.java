package com.resource.naming.slug;

import com.resource.naming.core.model.SlugMapping;
import com.resource.naming.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed slug table stored as :SlugMapping nodes keyed by resource type.
 * Lookup values always travel as query parameters.
 */
public class GraphSlugRepository implements SlugRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphSlugRepository.class);

    private static final String RETURN_COLUMNS = """
            RETURN s.resourceType as resourceType, s.slug as slug, s.fullName as fullName,
                   s.updatedAt as updatedAt, s.source as source
            """;

    private final GraphConnection connection;

    public GraphSlugRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Optional<SlugMapping> findByTypeOrName(String candidate) {
        String query = """
                MATCH (s:SlugMapping)
                WHERE s.resourceType = $candidate OR s.fullName = $candidate
                """ + RETURN_COLUMNS + """
                LIMIT 1
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of("candidate", candidate));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapRow(rows.get(0)));
    }

    /**
     * Writes every mapping with one {@code UNWIND} statement, so a sync lands in a single
     * store transaction and concurrent readers see either none or all of it.
     */
    @Override
    public int upsertAll(Collection<SlugMapping> mappings) {
        if (mappings.isEmpty()) {
            return 0;
        }
        List<Map<String, Object>> rows = new ArrayList<>(mappings.size());
        for (SlugMapping mapping : mappings) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("resourceType", mapping.resourceType());
            row.put("slug", mapping.slug());
            row.put("fullName", mapping.fullName());
            row.put("updatedAt", mapping.updatedAt().toString());
            row.put("source", mapping.source());
            rows.add(row);
        }
        String query = """
                UNWIND $rows AS row
                MERGE (s:SlugMapping {resourceType: row.resourceType})
                SET s.slug = row.slug, s.fullName = row.fullName, s.updatedAt = row.updatedAt, s.source = row.source
                """;
        connection.execute(query, Map.of("rows", rows));
        log.debug("slug.upserted count={}", rows.size());
        return rows.size();
    }

    @Override
    public List<SlugMapping> findAll() {
        String query = "MATCH (s:SlugMapping)\n" + RETURN_COLUMNS + "ORDER BY s.resourceType ASC\n";
        List<SlugMapping> mappings = new ArrayList<>();
        for (Map<String, Object> row : connection.query(query)) {
            mappings.add(mapRow(row));
        }
        return mappings;
    }

    @Override
    public int count() {
        List<Map<String, Object>> results = connection.query("MATCH (s:SlugMapping) RETURN count(s) as cnt");
        if (results.isEmpty()) {
            return 0;
        }
        Object cnt = results.get(0).get("cnt");
        return cnt instanceof Number number ? number.intValue() : 0;
    }

    private SlugMapping mapRow(Map<String, Object> row) {
        Object updatedAt = row.get("updatedAt");
        return new SlugMapping(
                String.valueOf(row.get("resourceType")),
                String.valueOf(row.get("slug")),
                row.get("fullName") != null ? row.get("fullName").toString() : null,
                updatedAt != null ? Instant.parse(updatedAt.toString()) : null,
                row.get("source") != null ? row.get("source").toString() : null);
    }
}

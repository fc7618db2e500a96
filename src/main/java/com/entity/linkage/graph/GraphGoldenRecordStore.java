package com.entity.linkage.graph;

import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.exception.StorageException;
import com.entity.linkage.golden.GoldenRecord;
import com.entity.linkage.golden.GoldenRecordStore;
import com.entity.linkage.golden.ResolvedEdge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed golden records. Golden records are {@code :GoldenRecord}
 * nodes keyed by their deterministic key; each member record points at its
 * golden record through a {@code RESOLVED_TO} relationship.
 * Fields and provenance are serialized as JSON strings.
 */
public class GraphGoldenRecordStore implements GoldenRecordStore {
    private static final Logger log = LoggerFactory.getLogger(GraphGoldenRecordStore.class);

    public static final String GOLDEN_LABEL = "GoldenRecord";
    public static final String RESOLVED_TYPE = "RESOLVED_TO";

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, List<String>>> PROVENANCE_TYPE = new TypeReference<>() {
    };

    private final GraphConnection connection;
    private final String recordLabel;
    private final ObjectMapper objectMapper;

    public GraphGoldenRecordStore(GraphConnection connection, String recordLabel) {
        InputSanitizer.validateCollectionName(recordLabel);
        this.connection = connection;
        this.recordLabel = recordLabel;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public int upsertGoldenRecords(List<GoldenRecord> records) {
        int created = 0;
        for (GoldenRecord record : records) {
            if (!goldenExists(record.key())) {
                created++;
            }
            String query = """
                    MERGE (g:%s {key: $key})
                    SET g.memberIds = $memberIds,
                        g.fields = $fields,
                        g.provenance = $provenance,
                        g.runId = $runId,
                        g.method = $method,
                        g.updatedAt = $updatedAt
                    """.formatted(GOLDEN_LABEL);
            Map<String, Object> params = new HashMap<>();
            params.put("key", record.key());
            params.put("memberIds", record.memberIds());
            params.put("fields", toJson(record.fields()));
            params.put("provenance", toJson(record.provenance()));
            params.put("runId", record.runId());
            params.put("method", record.method());
            params.put("updatedAt", record.updatedAt() != null ? record.updatedAt().toEpochMilli() : null);
            execute(query, params);
        }
        log.debug("golden.upserted count={} created={}", records.size(), created);
        return created;
    }

    @Override
    public int insertResolvedEdges(List<ResolvedEdge> edges, boolean ignoreOnConflict) {
        int inserted = 0;
        for (ResolvedEdge edge : edges) {
            if (ignoreOnConflict && resolvedExists(edge.key())) {
                continue;
            }
            String query = """
                    MATCH (r:%s {id: $memberId}), (g:%s {key: $goldenKey})
                    MERGE (r)-[e:%s {key: $key}]->(g)
                    SET e.runId = $runId
                    RETURN count(e) as cnt
                    """.formatted(recordLabel, GOLDEN_LABEL, RESOLVED_TYPE);
            inserted += countOf(query(query, Map.of(
                    "memberId", edge.memberId(),
                    "goldenKey", edge.goldenKey(),
                    "key", edge.key(),
                    "runId", edge.runId())));
        }
        log.debug("golden.resolvedEdges requested={} inserted={}", edges.size(), inserted);
        return inserted;
    }

    @Override
    public Optional<GoldenRecord> findGoldenRecord(String key) {
        String query = """
                MATCH (g:%s {key: $key})
                RETURN g.key as key, g.memberIds as memberIds, g.fields as fields,
                       g.provenance as provenance, g.runId as runId, g.method as method,
                       g.updatedAt as updatedAt
                """.formatted(GOLDEN_LABEL);
        List<Map<String, Object>> rows = query(query, Map.of("key", key));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToGoldenRecord(rows.get(0)));
    }

    @Override
    public long countGoldenRecords() {
        return countOf(query("MATCH (g:%s) RETURN count(g) as cnt".formatted(GOLDEN_LABEL), Map.of()));
    }

    @Override
    public long countResolvedEdges() {
        return countOf(query("MATCH ()-[e:%s]->() RETURN count(e) as cnt".formatted(RESOLVED_TYPE), Map.of()));
    }

    private boolean goldenExists(String key) {
        return countOf(query("MATCH (g:%s {key: $key}) RETURN count(g) as cnt".formatted(GOLDEN_LABEL),
                Map.of("key", key))) > 0;
    }

    private boolean resolvedExists(String key) {
        return countOf(query("MATCH ()-[e:%s {key: $key}]->() RETURN count(e) as cnt".formatted(RESOLVED_TYPE),
                Map.of("key", key))) > 0;
    }

    private GoldenRecord mapToGoldenRecord(Map<String, Object> row) {
        List<String> members = new ArrayList<>();
        if (row.get("memberIds") instanceof List<?> list) {
            list.forEach(m -> members.add(String.valueOf(m)));
        }
        Object updatedAt = row.get("updatedAt");
        Map<String, Object> fields = fromJson((String) row.get("fields"), FIELDS_TYPE);
        return new GoldenRecord(
                (String) row.get("key"),
                members,
                fields != null ? fields : Map.of(),
                fromJson((String) row.get("provenance"), PROVENANCE_TYPE),
                (String) row.get("runId"),
                (String) row.get("method"),
                updatedAt instanceof Number millis ? Instant.ofEpochMilli(millis.longValue()) : null);
    }

    private void execute(String query, Map<String, Object> params) {
        try {
            connection.execute(query, params);
        } catch (RuntimeException e) {
            throw new StorageException("Golden record write failed: " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> query(String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (RuntimeException e) {
            throw new StorageException("Golden record query failed: " + e.getMessage(), e);
        }
    }

    private static int countOf(List<Map<String, Object>> results) {
        if (results.isEmpty()) {
            return 0;
        }
        return ((Number) results.get(0).get("cnt")).intValue();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize golden record: " + e.getMessage(), e);
        }
    }

    private <T extends Map<String, ?>> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize golden record: " + e.getMessage(), e);
        }
    }
}

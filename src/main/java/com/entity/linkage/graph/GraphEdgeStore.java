package com.entity.linkage.graph;

import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.exception.StorageException;
import com.entity.linkage.core.model.MatchEdge;
import com.entity.linkage.edge.EdgeStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed edge collection. Edges are relationships typed with the edge
 * collection name between record nodes; metadata maps are serialized as JSON
 * strings and timestamps as epoch milliseconds.
 */
public class GraphEdgeStore implements EdgeStore {
    private static final Logger log = LoggerFactory.getLogger(GraphEdgeStore.class);

    private final GraphConnection connection;
    private final String recordLabel;
    private final String edgeType;
    private final ObjectMapper objectMapper;

    public GraphEdgeStore(GraphConnection connection, String recordLabel, String edgeType) {
        InputSanitizer.validateCollectionName(recordLabel);
        InputSanitizer.validateCollectionName(edgeType);
        this.connection = connection;
        this.recordLabel = recordLabel;
        this.edgeType = edgeType;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getEdgeCollection() {
        return edgeType;
    }

    /**
     * Writes the edges one by one. An edge whose endpoints are not both stored
     * is not written.
     */
    @Override
    public int insertEdges(List<MatchEdge> edges, boolean ignoreOnConflict) {
        int written = 0;
        for (MatchEdge edge : edges) {
            if (ignoreOnConflict && exists(edge)) {
                continue;
            }
            String query = """
                    MATCH (a:%1$s {id: $fromId}), (b:%1$s {id: $toId})
                    MERGE (a)-[e:%2$s {key: $key}]->(b)
                    SET e.similarity = $similarity,
                        e.method = $method,
                        e.timestamp = $timestamp,
                        e.metadata = $metadata
                    RETURN count(e) as cnt
                    """.formatted(recordLabel, edgeType);
            Map<String, Object> params = new HashMap<>();
            params.put("fromId", edge.fromId());
            params.put("toId", edge.toId());
            params.put("key", edge.key());
            params.put("similarity", edge.similarity());
            params.put("method", edge.method());
            params.put("timestamp", edge.timestamp().toEpochMilli());
            params.put("metadata", serializeMetadata(edge.metadata()));
            written += countOf(run(query, params));
        }
        log.debug("edges.inserted type={} requested={} written={}", edgeType, edges.size(), written);
        return written;
    }

    private boolean exists(MatchEdge edge) {
        String query = """
                MATCH (a:%1$s {id: $fromId})-[e:%2$s {key: $key}]->(b:%1$s {id: $toId})
                RETURN count(e) as cnt
                """.formatted(recordLabel, edgeType);
        return countOf(run(query, Map.of(
                "fromId", edge.fromId(),
                "toId", edge.toId(),
                "key", edge.key()))) > 0;
    }

    @Override
    public int clearEdges(String method, Instant olderThan) {
        String where = whereClause(method, olderThan);
        Map<String, Object> params = new HashMap<>();
        if (method != null) {
            params.put("method", method);
        }
        if (olderThan != null) {
            params.put("olderThan", olderThan.toEpochMilli());
        }
        int matched = countOf(run("""
                MATCH ()-[e:%s]->()
                %s
                RETURN count(e) as cnt
                """.formatted(edgeType, where), params));
        if (matched == 0) {
            return 0;
        }
        try {
            connection.execute("""
                    MATCH ()-[e:%s]->()
                    %s
                    DELETE e
                    """.formatted(edgeType, where), params);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to clear edges of type " + edgeType, e);
        }
        log.info("edges.cleared type={} method={} olderThan={} removed={}", edgeType, method, olderThan, matched);
        return matched;
    }

    @Override
    public List<MatchEdge> findEdges(String method, double minSimilarity, int limit) {
        Map<String, Object> params = new HashMap<>();
        List<String> conditions = new ArrayList<>(2);
        if (!Double.isInfinite(minSimilarity)) {
            conditions.add("e.similarity >= $minSimilarity");
            params.put("minSimilarity", minSimilarity);
        }
        if (method != null) {
            conditions.add("e.method = $method");
            params.put("method", method);
        }
        String where = conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions);
        String limitClause = "";
        if (limit > 0) {
            limitClause = "LIMIT $limit";
            params.put("limit", limit);
        }
        String query = """
                MATCH (a:%1$s)-[e:%2$s]->(b:%1$s)
                %3$s
                RETURN e.key as key, a.id as fromId, b.id as toId, e.similarity as similarity,
                       e.method as method, e.timestamp as timestamp, e.metadata as metadata
                ORDER BY e.key ASC, a.id ASC
                %4$s
                """.formatted(recordLabel, edgeType, where, limitClause);
        return run(query, params).stream().map(this::mapToEdge).toList();
    }

    @Override
    public long count() {
        List<Map<String, Object>> results = run("""
                MATCH ()-[e:%s]->()
                RETURN count(e) as cnt
                """.formatted(edgeType), Map.of());
        return countOf(results);
    }

    private static String whereClause(String method, Instant olderThan) {
        List<String> conditions = new ArrayList<>(2);
        if (method != null) {
            conditions.add("e.method = $method");
        }
        if (olderThan != null) {
            conditions.add("e.timestamp < $olderThan");
        }
        return conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions);
    }

    private MatchEdge mapToEdge(Map<String, Object> row) {
        Object timestamp = row.get("timestamp");
        return new MatchEdge(
                (String) row.get("key"),
                (String) row.get("fromId"),
                (String) row.get("toId"),
                ((Number) row.get("similarity")).doubleValue(),
                (String) row.get("method"),
                timestamp instanceof Number millis ? Instant.ofEpochMilli(millis.longValue()) : null,
                deserializeMetadata((String) row.get("metadata")));
    }

    private List<Map<String, Object>> run(String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (RuntimeException e) {
            throw new StorageException("Edge query on " + edgeType + " failed: " + e.getMessage(), e);
        }
    }

    private static int countOf(List<Map<String, Object>> results) {
        if (results.isEmpty()) {
            return 0;
        }
        return ((Number) results.get(0).get("cnt")).intValue();
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize edge metadata: {}", e.getMessage());
            return "{}";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> deserializeMetadata(String json) {
        if (json == null || json.isEmpty() || "{}".equals(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, Map.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize edge metadata: {}", e.getMessage());
            return Map.of();
        }
    }
}

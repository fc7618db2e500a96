package com.entity.linkage.graph;

import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.exception.StorageException;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.store.CursorPage;
import com.entity.linkage.store.RecordStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * FalkorDB-backed record collection. Each record is a node labelled with the
 * collection name, holding its id and fields as properties.
 *
 * <p>Fields named as vector fields are written with {@code vecf32} so a
 * vector index can cover them. Map-valued fields are stored as JSON strings.</p>
 */
public class GraphRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(GraphRecordStore.class);

    private final GraphConnection connection;
    private final String label;
    private final Set<String> vectorFields;
    private final ObjectMapper objectMapper;

    public GraphRecordStore(GraphConnection connection, String label) {
        this(connection, label, Set.of());
    }

    public GraphRecordStore(GraphConnection connection, String label, Set<String> vectorFields) {
        InputSanitizer.validateCollectionName(label);
        vectorFields.forEach(InputSanitizer::validateFieldName);
        this.connection = connection;
        this.label = label;
        this.vectorFields = Set.copyOf(vectorFields);
        this.objectMapper = new ObjectMapper();
        createIndexes();
    }

    private void createIndexes() {
        try {
            connection.execute("CREATE INDEX FOR (r:" + label + ") ON (r.id)");
        } catch (Exception e) {
            log.debug("Index creation query result: {} - {}", label, e.getMessage());
        }
    }

    @Override
    public String getCollectionName() {
        return label;
    }

    @Override
    public Optional<Record> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        InputSanitizer.validateRecordId(id);
        String query = """
                MATCH (r:%s {id: $id})
                RETURN r.id as id, properties(r) as props
                """.formatted(label);
        List<Record> results = mapResults(run(query, Map.of("id", id)));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Record> findByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        ids.forEach(InputSanitizer::validateRecordId);
        String query = """
                MATCH (r:%s)
                WHERE r.id IN $ids
                RETURN r.id as id, properties(r) as props
                ORDER BY r.id ASC
                """.formatted(label);
        return mapResults(run(query, Map.of("ids", List.copyOf(ids))));
    }

    @Override
    public CursorPage<Record> fetchPage(String afterId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        // Fetch limit + 1 to detect if there are more results
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("limit", limit + 1);
        String query;
        if (afterId != null) {
            query = """
                    MATCH (r:%s)
                    WHERE r.id > $afterId
                    RETURN r.id as id, properties(r) as props
                    ORDER BY r.id ASC
                    LIMIT $limit
                    """.formatted(label);
            params.put("afterId", afterId);
        } else {
            query = """
                    MATCH (r:%s)
                    RETURN r.id as id, properties(r) as props
                    ORDER BY r.id ASC
                    LIMIT $limit
                    """.formatted(label);
        }
        List<Record> results = mapResults(run(query, params));
        boolean hasMore = results.size() > limit;
        List<Record> content = hasMore ? results.subList(0, limit) : results;
        String nextCursor = hasMore ? content.get(content.size() - 1).id() : null;
        return new CursorPage<>(content, nextCursor, hasMore);
    }

    @Override
    public long count() {
        String query = """
                MATCH (r:%s)
                RETURN count(r) as cnt
                """.formatted(label);
        List<Map<String, Object>> results = run(query, Map.of());
        if (results.isEmpty()) {
            return 0;
        }
        return ((Number) results.get(0).get("cnt")).longValue();
    }

    @Override
    public int updateFields(Map<String, Map<String, Object>> updatesById) {
        int updated = 0;
        for (Map.Entry<String, Map<String, Object>> entry : updatesById.entrySet()) {
            InputSanitizer.validateRecordId(entry.getKey());
            if (entry.getValue().isEmpty()) {
                continue;
            }
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("id", entry.getKey());
            String query = """
                    MATCH (r:%s {id: $id})
                    SET %s
                    RETURN count(r) as cnt
                    """.formatted(label, assignments(entry.getValue(), params));
            List<Map<String, Object>> results = run(query, params);
            if (!results.isEmpty() && ((Number) results.get(0).get("cnt")).intValue() > 0) {
                updated++;
            }
        }
        log.debug("records.updated label={} requested={} updated={}", label, updatesById.size(), updated);
        return updated;
    }

    /**
     * Creates or replaces records by id.
     *
     * @return number of records written
     */
    public int saveAll(Collection<Record> records) {
        for (Record record : records) {
            InputSanitizer.validateRecordId(record.id());
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("id", record.id());
            Map<String, Object> fields = new LinkedHashMap<>(record.fields());
            fields.remove("id");
            String query = fields.isEmpty()
                    ? "MERGE (r:%s {id: $id})".formatted(label)
                    : """
                    MERGE (r:%s {id: $id})
                    SET %s
                    """.formatted(label, assignments(fields, params));
            try {
                connection.execute(query, params);
            } catch (RuntimeException e) {
                throw new StorageException("Failed to save record " + record.id() + " to " + label, e);
            }
        }
        log.debug("records.saved label={} count={}", label, records.size());
        return records.size();
    }

    @Override
    public Optional<String> getEngineVersion() {
        return connection.getServerVersion();
    }

    /**
     * Builds the SET clause, adding one parameter per field.
     */
    private String assignments(Map<String, Object> fields, Map<String, Object> params) {
        List<String> parts = new ArrayList<>(fields.size());
        int i = 0;
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            InputSanitizer.validateFieldName(field.getKey());
            String param = "p" + i++;
            Object value = field.getValue();
            if (value instanceof Map<?, ?> map) {
                value = toJson(map);
            }
            if (value instanceof double[] vector) {
                value = toList(vector);
            }
            params.put(param, value);
            String target = value != null && vectorFields.contains(field.getKey())
                    ? "vecf32($" + param + ")"
                    : "$" + param;
            parts.add("r." + field.getKey() + " = " + target);
        }
        return String.join(", ", parts);
    }

    private List<Map<String, Object>> run(String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (RuntimeException e) {
            throw new StorageException("Query against " + label + " failed: " + e.getMessage(), e);
        }
    }

    private List<Record> mapResults(List<Map<String, Object>> rows) {
        List<Record> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String id = (String) row.get("id");
            Map<String, Object> fields = new LinkedHashMap<>();
            if (row.get("props") instanceof Map<?, ?> props) {
                props.forEach((k, v) -> fields.put(String.valueOf(k), v));
            }
            fields.remove("id");
            records.add(new Record(id, fields));
        }
        return records;
    }

    private String toJson(Map<?, ?> map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize map field: " + e.getMessage(), e);
        }
    }

    private static List<Double> toList(double[] vector) {
        List<Double> list = new ArrayList<>(vector.length);
        for (double x : vector) {
            list.add(x);
        }
        return list;
    }
}

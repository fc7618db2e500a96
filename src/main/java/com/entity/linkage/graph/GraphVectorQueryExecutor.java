package com.entity.linkage.graph;

import com.entity.linkage.ann.EngineVersion;
import com.entity.linkage.ann.SearchMethod;
import com.entity.linkage.ann.SearchRequest;
import com.entity.linkage.ann.VectorMatch;
import com.entity.linkage.ann.VectorPair;
import com.entity.linkage.ann.VectorQueryExecutor;
import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Native vector search through FalkorDB's vector index
 * ({@code db.idx.vector.queryNodes}). The index reports cosine distance,
 * converted here to similarity as {@code 1 - distance}.
 */
public class GraphVectorQueryExecutor implements VectorQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(GraphVectorQueryExecutor.class);

    /** First engine release with vector indexes. */
    public static final EngineVersion MIN_VERSION = new EngineVersion(4, 0, 0);

    /** Extra neighbours requested to leave room for filtered-out candidates. */
    static final int OVERFETCH = 5;

    private final GraphConnection connection;
    private final RecordStore recordStore;
    private final String label;
    private final String embeddingField;

    public GraphVectorQueryExecutor(GraphConnection connection, RecordStore recordStore, String embeddingField) {
        InputSanitizer.validateFieldName(embeddingField);
        this.connection = connection;
        this.recordStore = recordStore;
        this.label = recordStore.getCollectionName();
        this.embeddingField = embeddingField;
    }

    @Override
    public SearchMethod method() {
        return SearchMethod.NATIVE;
    }

    /**
     * True when the engine is recent enough and a vector index covers the
     * embedding field. An engine that reports no version is judged by the index alone.
     */
    @Override
    public boolean probe() {
        Optional<EngineVersion> version = connection.getServerVersion().flatMap(EngineVersion::parse);
        if (version.isPresent() && !version.get().isAtLeast(MIN_VERSION)) {
            log.info("ann.probe.unsupported version={} required={}", version.get(), MIN_VERSION);
            return false;
        }
        boolean indexed = hasVectorIndex();
        log.info("ann.probe label={} field={} version={} indexed={}",
                label, embeddingField, version.map(EngineVersion::toString).orElse("unknown"), indexed);
        return indexed;
    }

    private boolean hasVectorIndex() {
        List<Map<String, Object>> rows = connection.query(
                "CALL db.indexes() YIELD label, properties RETURN label, properties");
        for (Map<String, Object> row : rows) {
            if (label.equals(row.get("label"))
                    && row.get("properties") instanceof List<?> properties
                    && properties.contains(embeddingField)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Creates the cosine vector index over the embedding field.
     */
    public void createVectorIndex(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1");
        }
        String query = """
                CREATE VECTOR INDEX FOR (r:%s) ON (r.%s)
                OPTIONS {dimension: %d, similarityFunction: 'cosine'}
                """.formatted(label, embeddingField, dimension);
        connection.execute(query);
        log.info("ann.index.created label={} field={} dimension={}", label, embeddingField, dimension);
    }

    @Override
    public List<VectorMatch> search(double[] queryVector, SearchRequest request) {
        String query = """
                CALL db.idx.vector.queryNodes('%s', '%s', $k, vecf32($vector))
                YIELD node, score
                RETURN node.id as id, score, properties(node) as props
                """.formatted(label, embeddingField);
        Map<String, Object> params = new HashMap<>();
        params.put("k", request.limit() + OVERFETCH + (request.filters().isEmpty() ? 0 : request.limit()));
        params.put("vector", queryVector);

        List<VectorMatch> matches = new ArrayList<>();
        for (Map<String, Object> row : connection.query(query, params)) {
            Record candidate = toRecord(row);
            if (!request.accepts(candidate)) {
                continue;
            }
            double similarity = 1.0 - ((Number) row.get("score")).doubleValue();
            if (similarity >= request.threshold()) {
                matches.add(new VectorMatch(candidate.id(), similarity, method().tag()));
            }
        }
        matches.sort(VectorMatch.BY_SIMILARITY);
        return matches.size() > request.limit() ? new ArrayList<>(matches.subList(0, request.limit())) : matches;
    }

    /**
     * Runs one index query per stored vector and merges the neighbour lists,
     * keeping the higher similarity when both directions report a pair.
     */
    @Override
    public List<VectorPair> findAllPairs(SearchRequest request) {
        Map<List<String>, VectorPair> pairs = new LinkedHashMap<>();
        int[] queries = {0};
        recordStore.forEachRecord(RecordStore.DEFAULT_PAGE_SIZE, record -> {
            if (!RecordFilter.all(request.filters(), record)) {
                return;
            }
            double[] vector = record.getVector(embeddingField);
            if (vector == null) {
                return;
            }
            Object blockingValue = null;
            if (request.blockingField() != null) {
                blockingValue = record.getString(request.blockingField());
                if (blockingValue == null) {
                    return;
                }
            }
            SearchRequest perRecord = new SearchRequest(request.threshold(), request.limit(), record.id(),
                    request.blockingField(), blockingValue, request.filters());
            queries[0]++;
            for (VectorMatch match : search(vector, perRecord)) {
                VectorPair pair = new VectorPair(record.id(), match.key(), match.similarity(), method().tag());
                pairs.merge(pair.ids(), pair, (a, b) -> a.similarity() >= b.similarity() ? a : b);
            }
        });
        List<VectorPair> result = new ArrayList<>(pairs.values());
        result.sort(VectorPair.BY_SIMILARITY);
        log.debug("ann.native.allPairs label={} queries={} pairs={}", label, queries[0], result.size());
        return result;
    }

    private static Record toRecord(Map<String, Object> row) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (row.get("props") instanceof Map<?, ?> props) {
            props.forEach((k, v) -> fields.put(String.valueOf(k), v));
        }
        fields.remove("id");
        return new Record((String) row.get("id"), fields);
    }
}

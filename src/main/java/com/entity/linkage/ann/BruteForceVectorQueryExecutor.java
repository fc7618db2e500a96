package com.entity.linkage.ann;

import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-process cosine similarity scan over the record store.
 * Always available, so it is also the fallback for native search failures.
 */
public class BruteForceVectorQueryExecutor implements VectorQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(BruteForceVectorQueryExecutor.class);

    private final RecordStore store;
    private final String embeddingField;
    private final int pageSize;

    public BruteForceVectorQueryExecutor(RecordStore store, String embeddingField) {
        this(store, embeddingField, RecordStore.DEFAULT_PAGE_SIZE);
    }

    public BruteForceVectorQueryExecutor(RecordStore store, String embeddingField, int pageSize) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddingField = Objects.requireNonNull(embeddingField, "embeddingField must not be null");
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
        this.pageSize = pageSize;
    }

    @Override
    public SearchMethod method() {
        return SearchMethod.BRUTE_FORCE;
    }

    @Override
    public boolean probe() {
        return true;
    }

    @Override
    public List<VectorMatch> search(double[] queryVector, SearchRequest request) {
        List<VectorMatch> matches = new ArrayList<>();
        store.forEachRecord(pageSize, record -> {
            if (!request.accepts(record)) {
                return;
            }
            double[] vector = record.getVector(embeddingField);
            if (vector == null || vector.length != queryVector.length) {
                return;
            }
            double similarity = VectorMath.cosine(queryVector, vector);
            if (similarity >= request.threshold()) {
                matches.add(new VectorMatch(record.id(), similarity, method().tag()));
            }
        });
        matches.sort(VectorMatch.BY_SIMILARITY);
        return matches.size() > request.limit() ? new ArrayList<>(matches.subList(0, request.limit())) : matches;
    }

    @Override
    public List<VectorPair> findAllPairs(SearchRequest request) {
        Map<String, List<Entry>> groups = new LinkedHashMap<>();
        int[] dimension = {-1};
        int[] skipped = {0};

        store.forEachRecord(pageSize, record -> {
            if (!RecordFilter.all(request.filters(), record)) {
                return;
            }
            double[] vector = record.getVector(embeddingField);
            if (vector == null) {
                return;
            }
            if (dimension[0] < 0) {
                dimension[0] = vector.length;
            } else if (vector.length != dimension[0]) {
                skipped[0]++;
                return;
            }
            String group = "";
            if (request.blockingField() != null) {
                group = record.getString(request.blockingField());
                if (group == null) {
                    return;
                }
            }
            groups.computeIfAbsent(group, g -> new ArrayList<>())
                    .add(new Entry(record.id(), VectorMath.normalize(vector)));
        });
        if (skipped[0] > 0) {
            log.warn("ann.bruteForce.dimensionMismatch field={} skipped={}", embeddingField, skipped[0]);
        }

        Map<List<String>, VectorPair> pairs = new HashMap<>();
        for (List<Entry> group : groups.values()) {
            for (Entry entry : group) {
                List<VectorMatch> neighbours = new ArrayList<>();
                for (Entry other : group) {
                    if (other == entry) {
                        continue;
                    }
                    double similarity = VectorMath.dot(entry.vector(), other.vector());
                    if (similarity >= request.threshold()) {
                        neighbours.add(new VectorMatch(other.id(), similarity, method().tag()));
                    }
                }
                neighbours.sort(VectorMatch.BY_SIMILARITY);
                int count = Math.min(request.limit(), neighbours.size());
                for (int i = 0; i < count; i++) {
                    VectorMatch match = neighbours.get(i);
                    VectorPair pair = new VectorPair(entry.id(), match.key(), match.similarity(), method().tag());
                    pairs.merge(pair.ids(), pair,
                            (a, b) -> a.similarity() >= b.similarity() ? a : b);
                }
            }
        }

        List<VectorPair> result = new ArrayList<>(pairs.values());
        result.sort(VectorPair.BY_SIMILARITY);
        return result;
    }

    private record Entry(String id, double[] vector) {
    }
}

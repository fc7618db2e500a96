package com.entity.linkage.edge;

import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.model.MatchEdge;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-process edge collection keyed by edge key and direction.
 */
public class InMemoryEdgeStore implements EdgeStore {

    private final String edgeCollection;
    private final Map<String, MatchEdge> edges = new ConcurrentSkipListMap<>();

    public InMemoryEdgeStore(String edgeCollection) {
        InputSanitizer.validateCollectionName(edgeCollection);
        this.edgeCollection = edgeCollection;
    }

    @Override
    public String getEdgeCollection() {
        return edgeCollection;
    }

    @Override
    public synchronized int insertEdges(List<MatchEdge> batch, boolean ignoreOnConflict) {
        int written = 0;
        for (MatchEdge edge : batch) {
            String identity = identity(edge);
            if (ignoreOnConflict && edges.containsKey(identity)) {
                continue;
            }
            edges.put(identity, edge);
            written++;
        }
        return written;
    }

    @Override
    public synchronized int clearEdges(String method, Instant olderThan) {
        int removed = 0;
        Iterator<MatchEdge> it = edges.values().iterator();
        while (it.hasNext()) {
            MatchEdge edge = it.next();
            boolean methodMatches = method == null || method.equals(edge.method());
            boolean ageMatches = olderThan == null || edge.timestamp().isBefore(olderThan);
            if (methodMatches && ageMatches) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<MatchEdge> findEdges(String method, double minSimilarity, int limit) {
        List<MatchEdge> result = new ArrayList<>();
        for (MatchEdge edge : edges.values()) {
            if (limit > 0 && result.size() >= limit) {
                break;
            }
            if ((method == null || method.equals(edge.method())) && edge.similarity() >= minSimilarity) {
                result.add(edge);
            }
        }
        return result;
    }

    @Override
    public long count() {
        return edges.size();
    }

    private static String identity(MatchEdge edge) {
        return edge.key() + ":" + edge.fromId() + "->" + edge.toId();
    }
}

package com.entity.linkage.edge;

import com.entity.linkage.core.model.MatchDecision;
import com.entity.linkage.core.model.MatchEdge;
import com.entity.linkage.logging.LogContext;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.scoring.FieldSimilarity;
import com.entity.linkage.scoring.PairScore;
import com.entity.linkage.scoring.SimilarityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates similarity edges in batches with deterministic keys.
 *
 * <p>Similarities are rounded to four decimals before they are stored. A
 * batch that fails is logged and counted, and the next batch still runs.</p>
 */
public class SimilarityEdgeService {
    private static final Logger log = LoggerFactory.getLogger(SimilarityEdgeService.class);

    public static final int DEFAULT_BATCH_SIZE = 1000;

    private final EdgeStore edgeStore;
    private final int batchSize;
    private final MetricsService metricsService;
    private final Clock clock;

    public SimilarityEdgeService(EdgeStore edgeStore) {
        this(edgeStore, DEFAULT_BATCH_SIZE, NoOpMetricsService.INSTANCE, Clock.systemUTC());
    }

    public SimilarityEdgeService(EdgeStore edgeStore, int batchSize, MetricsService metricsService, Clock clock) {
        if (edgeStore == null) {
            throw new IllegalArgumentException("edgeStore must not be null");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.edgeStore = edgeStore;
        this.batchSize = batchSize;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Creates one edge per request, or two edges sharing a key when bidirectional.
     *
     * @param requests         edges to create
     * @param method           method tag stored on every edge
     * @param bidirectional    also write the reverse edge
     * @param ignoreOnConflict leave already stored edges untouched
     */
    public EdgeWriteResult createEdges(List<EdgeRequest> requests, String method,
                                       boolean bidirectional, boolean ignoreOnConflict) {
        Instant now = clock.instant();
        List<MatchEdge> edges = new ArrayList<>(bidirectional ? requests.size() * 2 : requests.size());
        for (EdgeRequest request : requests) {
            MatchEdge edge = new MatchEdge(EdgeKeys.edgeKey(request.fromId(), request.toId()),
                    request.fromId(), request.toId(), SimilarityResult.round(request.similarity()),
                    method, now, request.metadata());
            edges.add(edge);
            if (bidirectional) {
                edges.add(edge.reversed());
            }
        }
        return writeBatches(edges, ignoreOnConflict);
    }

    /**
     * Creates edges for the pairs scored as matches. Scores that failed or
     * did not reach a match decision are skipped.
     *
     * @param includeFieldDetail also store per-field similarities on each edge
     */
    public EdgeWriteResult createEdgesFromScores(List<PairScore> scores, String method,
                                                 boolean bidirectional, boolean includeFieldDetail) {
        List<EdgeRequest> requests = new ArrayList<>();
        for (PairScore score : scores) {
            if (!score.isSuccess() || score.result().decision() != MatchDecision.MATCH) {
                continue;
            }
            SimilarityResult result = score.result();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("decision", result.decision().label());
            metadata.put("confidence", SimilarityResult.round(result.confidence()));
            metadata.put("fields_compared", result.fieldsCompared());
            if (includeFieldDetail) {
                for (FieldSimilarity field : result.fields()) {
                    metadata.put("field_" + field.field() + "_" + field.algorithm(),
                            SimilarityResult.round(field.similarity()));
                }
            }
            requests.add(new EdgeRequest(score.leftId(), score.rightId(), result.score(), metadata));
        }
        return createEdges(requests, method, bidirectional, true);
    }

    /**
     * Deletes edges by method tag and/or age; null criteria match all edges.
     */
    public int clearEdges(String method, Instant olderThan) {
        int removed = edgeStore.clearEdges(method, olderThan);
        log.info("edges.cleared collection={} method={} olderThan={} removed={}",
                edgeStore.getEdgeCollection(), method, olderThan, removed);
        return removed;
    }

    public int getBatchSize() {
        return batchSize;
    }

    private EdgeWriteResult writeBatches(List<MatchEdge> edges, boolean ignoreOnConflict) {
        Instant start = Instant.now();
        int created = 0;
        int batches = 0;
        int failed = 0;
        List<String> errors = new ArrayList<>();

        for (int from = 0; from < edges.size(); from += batchSize) {
            List<MatchEdge> batch = edges.subList(from, Math.min(edges.size(), from + batchSize));
            batches++;
            try (LogContext ignored = LogContext.forBatch(edgeStore.getEdgeCollection() + "-" + batches)) {
                created += edgeStore.insertEdges(batch, ignoreOnConflict);
                metricsService.recordEdgeBatch(batch.size(), true);
            } catch (RuntimeException e) {
                failed++;
                errors.add("Batch " + batches + " (" + batch.size() + " edges): " + e.getMessage());
                metricsService.recordEdgeBatch(batch.size(), false);
                log.error("edges.batch.failed collection={} batch={} size={} error={}",
                        edgeStore.getEdgeCollection(), batches, batch.size(), e.getMessage(), e);
            }
        }

        long millis = Duration.between(start, Instant.now()).toMillis();
        EdgeWriteResult result = new EdgeWriteResult(created, batches, failed, errors, millis);
        log.info("edges.created collection={} edges={} batches={} failedBatches={} edgesPerSecond={}",
                edgeStore.getEdgeCollection(), created, batches, failed, result.edgesPerSecond());
        return result;
    }
}

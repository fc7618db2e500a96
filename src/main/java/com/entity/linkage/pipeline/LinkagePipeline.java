package com.entity.linkage.pipeline;

import com.entity.linkage.ann.AnnAdapter;
import com.entity.linkage.ann.VectorQueryExecutor;
import com.entity.linkage.blocking.BlockingParams;
import com.entity.linkage.blocking.BlockingStrategies;
import com.entity.linkage.blocking.BlockingStrategy;
import com.entity.linkage.blocking.CompositeBlockingParams;
import com.entity.linkage.blocking.SharedNeighbourSource;
import com.entity.linkage.cluster.ClusteringResult;
import com.entity.linkage.cluster.WccClusteringService;
import com.entity.linkage.config.LinkageConfig;
import com.entity.linkage.core.model.CandidatePair;
import com.entity.linkage.core.model.MatchDecision;
import com.entity.linkage.core.model.MatchEdge;
import com.entity.linkage.edge.EdgeStore;
import com.entity.linkage.edge.EdgeWriteResult;
import com.entity.linkage.edge.SimilarityEdgeService;
import com.entity.linkage.embedding.EmbeddingResult;
import com.entity.linkage.embedding.Node2VecEmbeddingService;
import com.entity.linkage.embedding.WeightedEdge;
import com.entity.linkage.golden.GoldenRecordRunResult;
import com.entity.linkage.golden.GoldenRecordService;
import com.entity.linkage.golden.GoldenRecordStore;
import com.entity.linkage.golden.MostFrequentValuePolicy;
import com.entity.linkage.logging.LogContext;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.scoring.BatchScoringResult;
import com.entity.linkage.scoring.FellegiSunterScorer;
import com.entity.linkage.scoring.PairScore;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a full linkage pass over one record collection:
 * blocking, batch scoring, edge creation for {@code match} decisions,
 * WCC clustering over the stored edges and golden record consolidation.
 *
 * <pre>
 * LinkagePipeline pipeline = new LinkagePipeline(config, records, edges, golden);
 * PipelineResult result = pipeline.run(List.of(ExactBlockingParams.of("email")));
 * </pre>
 */
public class LinkagePipeline {
    private static final Logger log = LoggerFactory.getLogger(LinkagePipeline.class);

    private final LinkageConfig config;
    private final RecordStore recordStore;
    private final EdgeStore edgeStore;
    private final MetricsService metricsService;
    private final BlockingStrategies strategies;
    private final FellegiSunterScorer scorer;
    private final SimilarityEdgeService edgeService;
    private final WccClusteringService clusteringService;
    private final GoldenRecordService goldenRecordService;

    public LinkagePipeline(LinkageConfig config, RecordStore recordStore, EdgeStore edgeStore,
                           GoldenRecordStore goldenRecordStore) {
        this(config, recordStore, edgeStore, goldenRecordStore, null, NoOpMetricsService.INSTANCE, Clock.systemUTC());
    }

    /**
     * @param nativeExecutor native vector search for vector blocking, or null to scan in process
     */
    public LinkagePipeline(LinkageConfig config, RecordStore recordStore, EdgeStore edgeStore,
                           GoldenRecordStore goldenRecordStore, VectorQueryExecutor nativeExecutor,
                           MetricsService metricsService, Clock clock) {
        this(config, recordStore, edgeStore, goldenRecordStore, nativeExecutor, null, metricsService, clock);
    }

    /**
     * @param neighbours shared neighbour source for graph traversal blocking, or null when unused
     */
    public LinkagePipeline(LinkageConfig config, RecordStore recordStore, EdgeStore edgeStore,
                           GoldenRecordStore goldenRecordStore, VectorQueryExecutor nativeExecutor,
                           SharedNeighbourSource neighbours, MetricsService metricsService, Clock clock) {
        this.config = config;
        this.recordStore = recordStore;
        this.edgeStore = edgeStore;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
        AnnAdapter annAdapter = new AnnAdapter(recordStore, config.getEmbeddingField(), nativeExecutor,
                config.isForceBruteForce() || nativeExecutor == null, this.metricsService);
        this.strategies = new BlockingStrategies(recordStore, annAdapter, neighbours, config.getPageSize(),
                this.metricsService);
        this.scorer = new FellegiSunterScorer(config.getScoringConfig(), this.metricsService);
        this.edgeService = new SimilarityEdgeService(edgeStore, config.getEdgeBatchSize(), this.metricsService, clock);
        this.clusteringService = new WccClusteringService(config.getMinClusterSize(), this.metricsService);
        this.goldenRecordService = new GoldenRecordService(recordStore, goldenRecordStore, new MostFrequentValuePolicy(), clock);
    }

    public PipelineResult run(List<BlockingParams> blocking) {
        return run(LogContext.generateRunId(), blocking);
    }

    /**
     * Runs every stage once. Several blocking configurations are combined as
     * one composite strategy. Clustering reads all stored edges of the
     * configured method, so edges from earlier runs take part.
     */
    public PipelineResult run(String runId, List<BlockingParams> blocking) {
        if (blocking == null || blocking.isEmpty()) {
            throw new IllegalArgumentException("At least one blocking configuration is required");
        }
        Instant start = Instant.now();
        BlockingParams params = blocking.size() == 1
                ? blocking.get(0)
                : new CompositeBlockingParams(blocking);
        BlockingStrategy strategy = strategies.create(params);

        List<CandidatePair> candidates;
        BatchScoringResult scoring;
        EdgeWriteResult edgeResult;
        try (LogContext ignored = LogContext.forRun(runId)) {
            log.info("pipeline.started runId={} collection={} strategy={}",
                    runId, recordStore.getCollectionName(), strategy.getName());
            candidates = strategy.generateCandidates();
            scoring = scorer.computeBatchSimilarity(candidates, recordStore, false);
            edgeResult = edgeService.createEdgesFromScores(scoring.results(), config.getEdgeMethod(),
                    config.isBidirectionalEdges(), false);
            if (!edgeResult.isSuccess()) {
                log.warn("pipeline.edges.partial runId={} failedBatches={} errors={}",
                        runId, edgeResult.failedBatches(), edgeResult.errors());
            }
        }

        List<MatchEdge> edges = edgeStore.findEdges(config.getEdgeMethod(), Double.NEGATIVE_INFINITY, 0);
        ClusteringResult clustering = clusteringService.cluster(edges);
        GoldenRecordRunResult golden = goldenRecordService.run(runId, clustering.clusters(),
                config.getMinClusterSize(), config.getClusterMethod());

        long durationMillis = Duration.between(start, Instant.now()).toMillis();
        PipelineResult result = new PipelineResult(runId, strategy.getStatistics(), candidates.size(), scoring,
                countDecisions(scoring), edgeResult, clustering, golden, durationMillis);
        log.info("pipeline.completed runId={} candidates={} scored={} failed={} matches={} edges={} clusters={} goldenRecords={} durationMs={}",
                runId, candidates.size(), scoring.successfulPairs(), scoring.failedPairs(), result.matches(),
                edgeResult.edgesCreated(), result.clusterCount(), golden.goldenRecordsUpserted(), durationMillis);
        return result;
    }

    /**
     * Computes node2vec embeddings from the stored match edges and writes
     * them back onto the records.
     *
     * @param targetField   record field receiving the vectors
     * @param minConfidence minimum edge confidence to include
     * @param edgeLimit     maximum edges to read, 0 for the configured cap
     */
    public EmbeddingResult enrichEmbeddings(String targetField, double minConfidence, int edgeLimit) {
        Node2VecEmbeddingService embeddings = new Node2VecEmbeddingService(
                config.getNode2VecParams(), config.getSafetyLimits(), metricsService);
        List<WeightedEdge> edges = embeddings.fetchEdges(edgeStore, config.getEdgeMethod(), minConfidence, edgeLimit);
        EmbeddingResult result = embeddings.embed(edges);
        if (!result.isEmpty()) {
            embeddings.writeEmbeddings(recordStore, result, targetField, config.getEdgeBatchSize());
        }
        return result;
    }

    public LinkageConfig getConfig() {
        return config;
    }

    private static Map<MatchDecision, Integer> countDecisions(BatchScoringResult scoring) {
        Map<MatchDecision, Integer> counts = new EnumMap<>(MatchDecision.class);
        for (PairScore score : scoring.successes()) {
            counts.merge(score.result().decision(), 1, Integer::sum);
        }
        return counts;
    }
}

package com.entity.linkage.embedding;

import com.entity.linkage.ann.VectorMath;
import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.model.MatchEdge;
import com.entity.linkage.edge.EdgeStore;
import com.entity.linkage.logging.LogContext;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * node2vec-style graph embeddings for the match graph.
 *
 * <ol>
 *   <li>Biased random walks from every node, {@code numWalks} rounds of
 *       {@code walkLength} steps, driven by one seeded generator.</li>
 *   <li>A node co-occurrence matrix counted over a sliding window and symmetrized.</li>
 *   <li>A rank-{@code d} factorization {@code U * sqrt(S)} of that matrix,
 *       with {@code d = min(dimensions, nodes)}, rows scaled to unit length.</li>
 * </ol>
 *
 * <p>The same edges and seed give bit-identical vectors.</p>
 */
public class Node2VecEmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(Node2VecEmbeddingService.class);

    public static final String DEFAULT_EMBEDDING_FIELD = "embedding_node2vec";

    private final Node2VecParams params;
    private final SafetyLimits limits;
    private final MetricsService metricsService;

    public Node2VecEmbeddingService(Node2VecParams params) {
        this(params, SafetyLimits.defaults(), NoOpMetricsService.INSTANCE);
    }

    public Node2VecEmbeddingService(Node2VecParams params, SafetyLimits limits, MetricsService metricsService) {
        if (params == null || limits == null) {
            throw new IllegalArgumentException("params and limits are required");
        }
        limits.checkDimensions(params.dimensions());
        this.params = params;
        this.limits = limits;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    /**
     * Computes embeddings for every node touched by the edges.
     *
     * @return vectors keyed by record id; empty when there are no edges
     * @throws com.entity.linkage.core.exception.SafetyLimitExceededException if the graph is too large
     */
    public EmbeddingResult embed(Collection<WeightedEdge> edges) {
        try (LogContext ignored = LogContext.forEmbedding(params.seed())) {
            if (edges.isEmpty()) {
                log.info("embedding.skipped reason=noEdges");
                return new EmbeddingResult(Map.of(), metadata(0, 0));
            }
            Instant start = Instant.now();

            List<String> nodes = new ArrayList<>(nodesOf(edges));
            limits.checkNodes(nodes.size());
            if (nodes.size() > limits.warnNodesThreshold()) {
                log.warn("embedding.largeGraph nodes={} warnThreshold={} maxNodes={}",
                        nodes.size(), limits.warnNodesThreshold(), limits.maxNodes());
            }

            List<TreeMap<Integer, Double>> adjacency = buildAdjacency(nodes, edges);
            List<int[]> walks = generateWalks(adjacency);
            double[][] cooccurrence = cooccurrence(walks, nodes.size());

            int dimensions = Math.min(params.dimensions(), nodes.size());
            double[][] vectors = factorize(cooccurrence, dimensions);

            Map<String, double[]> result = new LinkedHashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                result.put(nodes.get(i), vectors[i]);
            }

            Duration elapsed = Duration.between(start, Instant.now());
            metricsService.recordEmbeddingDuration(nodes.size(), elapsed);
            log.info("embedding.completed nodes={} edges={} walks={} dimensions={} requestedDimensions={} durationMs={}",
                    nodes.size(), edges.size(), walks.size(), dimensions, params.dimensions(), elapsed.toMillis());
            return new EmbeddingResult(result, metadata(dimensions, nodes.size()));
        }
    }

    /**
     * Reads match edges from the edge store as weighted walk edges. The weight
     * is the stored confidence, or 1.0 when an edge has none. Reverse edges
     * sharing a key are read once.
     *
     * @param limit maximum edges to read; 0 reads up to {@code max_edges_fetched}
     * @throws com.entity.linkage.core.exception.SafetyLimitExceededException if the limit or
     *         the stored edge count exceeds {@code max_edges_fetched}
     */
    public List<WeightedEdge> fetchEdges(EdgeStore edgeStore, String method, double minConfidence, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        limits.checkEdges(limit);
        int effective = limit;
        if (limit == 0) {
            effective = limits.maxEdgesFetched();
            log.warn("embedding.edges.unbounded capping at max_edges_fetched={}", effective);
        }

        // read one past the cap so an oversized graph fails instead of being truncated
        List<MatchEdge> stored = edgeStore.findEdges(method, Double.NEGATIVE_INFINITY,
                limit == 0 ? effective + 1 : effective);
        if (limit == 0) {
            limits.checkEdges(stored.size());
        }

        Map<String, WeightedEdge> byKey = new LinkedHashMap<>();
        for (MatchEdge edge : stored) {
            Double confidence = confidenceOf(edge);
            if (confidence != null && confidence < minConfidence) {
                continue;
            }
            byKey.putIfAbsent(edge.key(), WeightedEdge.of(edge.fromId(), edge.toId(), confidence));
        }
        if (byKey.size() > limits.warnEdgesThreshold()) {
            log.warn("embedding.edges.many edges={} warnThreshold={}", byKey.size(), limits.warnEdgesThreshold());
        }
        log.info("embedding.edges.fetched collection={} edges={} method={}",
                edgeStore.getEdgeCollection(), byKey.size(), method);
        return new ArrayList<>(byKey.values());
    }

    /**
     * Writes embeddings back onto their records in batches, with the run
     * metadata under {@code <field>_meta}.
     *
     * @return number of records updated
     */
    public int writeEmbeddings(RecordStore recordStore, EmbeddingResult result, String field, int batchSize) {
        InputSanitizer.validateFieldName(field);
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        Map<String, Object> meta = result.metadata().toMap();
        int updated = 0;
        Map<String, Map<String, Object>> batch = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : result.vectors().entrySet()) {
            List<Double> vector = new ArrayList<>(entry.getValue().length);
            for (double x : entry.getValue()) {
                vector.add(x);
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(field, vector);
            attributes.put(field + "_meta", meta);
            batch.put(entry.getKey(), attributes);
            if (batch.size() == batchSize) {
                updated += recordStore.updateFields(batch);
                batch = new LinkedHashMap<>();
            }
        }
        if (!batch.isEmpty()) {
            updated += recordStore.updateFields(batch);
        }
        log.info("embedding.written collection={} field={} records={}",
                recordStore.getCollectionName(), field, updated);
        return updated;
    }

    public Node2VecParams getParams() {
        return params;
    }

    private static Set<String> nodesOf(Collection<WeightedEdge> edges) {
        Set<String> nodes = new TreeSet<>();
        for (WeightedEdge edge : edges) {
            nodes.add(edge.from());
            nodes.add(edge.to());
        }
        return nodes;
    }

    private List<TreeMap<Integer, Double>> buildAdjacency(List<String> nodes, Collection<WeightedEdge> edges) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }
        List<TreeMap<Integer, Double>> adjacency = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            adjacency.add(new TreeMap<>());
        }
        for (WeightedEdge edge : edges) {
            int from = index.get(edge.from());
            int to = index.get(edge.to());
            adjacency.get(from).merge(to, edge.weight(), Double::sum);
            if (!params.directed() && from != to) {
                adjacency.get(to).merge(from, edge.weight(), Double::sum);
            }
        }
        return adjacency;
    }

    List<int[]> generateWalks(List<TreeMap<Integer, Double>> adjacency) {
        Random random = new Random(params.seed());
        List<int[]> walks = new ArrayList<>(adjacency.size() * params.numWalks());
        for (int round = 0; round < params.numWalks(); round++) {
            for (int start = 0; start < adjacency.size(); start++) {
                walks.add(walk(adjacency, start, random));
            }
        }
        return walks;
    }

    private int[] walk(List<TreeMap<Integer, Double>> adjacency, int start, Random random) {
        int[] path = new int[params.walkLength()];
        path[0] = start;
        int length = 1;
        while (length < params.walkLength()) {
            int current = path[length - 1];
            TreeMap<Integer, Double> neighbours = adjacency.get(current);
            if (neighbours.isEmpty()) {
                break;
            }
            int previous = length > 1 ? path[length - 2] : -1;
            path[length++] = nextStep(adjacency, neighbours, previous, random);
        }
        return length == path.length ? path : Arrays.copyOf(path, length);
    }

    private int nextStep(List<TreeMap<Integer, Double>> adjacency, TreeMap<Integer, Double> neighbours,
                         int previous, Random random) {
        double[] weights = new double[neighbours.size()];
        int[] candidates = new int[neighbours.size()];
        double total = 0.0;
        int i = 0;
        for (Map.Entry<Integer, Double> entry : neighbours.entrySet()) {
            int candidate = entry.getKey();
            double bias = 1.0;
            if (previous >= 0) {
                if (candidate == previous) {
                    bias = 1.0 / params.returnParam();
                } else if (!adjacency.get(previous).containsKey(candidate)) {
                    bias = 1.0 / params.inOutParam();
                }
            }
            candidates[i] = candidate;
            weights[i] = entry.getValue() * bias;
            total += weights[i];
            i++;
        }
        double draw = random.nextDouble() * total;
        double cumulative = 0.0;
        for (int j = 0; j < candidates.length; j++) {
            cumulative += weights[j];
            if (draw < cumulative) {
                return candidates[j];
            }
        }
        return candidates[candidates.length - 1];
    }

    private double[][] cooccurrence(List<int[]> walks, int n) {
        double[][] counts = new double[n][n];
        int window = params.windowSize();
        for (int[] walk : walks) {
            for (int i = 0; i < walk.length; i++) {
                int from = Math.max(0, i - window);
                int to = Math.min(walk.length - 1, i + window);
                for (int j = from; j <= to; j++) {
                    if (j != i) {
                        counts[walk[i]][walk[j]] += 1.0;
                    }
                }
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double mean = 0.5 * (counts[i][j] + counts[j][i]);
                counts[i][j] = mean;
                counts[j][i] = mean;
            }
        }
        return counts;
    }

    private double[][] factorize(double[][] matrix, int dimensions) {
        int n = matrix.length;
        double[][] vectors = new double[n][dimensions];
        if (isZero(matrix)) {
            log.warn("embedding.zeroCooccurrence nodes={}; returning zero vectors", n);
            return vectors;
        }

        SymmetricEigenSolver.Decomposition decomposition = SymmetricEigenSolver.top(matrix, dimensions, params.seed());
        for (int k = 0; k < dimensions; k++) {
            double scale = Math.sqrt(Math.abs(decomposition.values()[k]));
            double[] component = decomposition.vectors()[k];
            for (int i = 0; i < n; i++) {
                vectors[i][k] = component[i] * scale;
            }
        }
        for (int i = 0; i < n; i++) {
            vectors[i] = VectorMath.normalize(vectors[i]);
        }
        return vectors;
    }

    private static boolean isZero(double[][] matrix) {
        for (double[] row : matrix) {
            for (double x : row) {
                if (x != 0.0) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Double confidenceOf(MatchEdge edge) {
        Object confidence = edge.metadata().get("confidence");
        return confidence instanceof Number number ? number.doubleValue() : null;
    }

    private EmbeddingMetadata metadata(int dimensions, int nodes) {
        return new EmbeddingMetadata(EmbeddingMetadata.METHOD, dimensions, params.dimensions(),
                params.walkLength(), params.numWalks(), params.windowSize(), params.seed(), nodes);
    }
}

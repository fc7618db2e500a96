package com.entity.linkage.config;

import com.entity.linkage.ann.VectorQuery;
import com.entity.linkage.cluster.WccClusteringService;
import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.exception.ValidationException;
import com.entity.linkage.edge.SimilarityEdgeService;
import com.entity.linkage.embedding.Node2VecParams;
import com.entity.linkage.embedding.SafetyLimits;
import com.entity.linkage.scoring.ScoringConfig;
import com.entity.linkage.store.RecordStore;

import java.util.Map;

/**
 * Settings for a linkage run. Immutable; validated once when built.
 *
 * <p>Overrides are layered on top of an existing config by dotted key, for
 * example {@code scoring.upperThreshold} or {@code edges.batchSize}. An
 * unknown key fails rather than being ignored.</p>
 */
public final class LinkageConfig {

    public static final int CURRENT_VERSION = 1;

    public static final String DEFAULT_EDGE_COLLECTION = "similarTo";
    public static final String DEFAULT_EDGE_METHOD = "fellegi_sunter";
    public static final String DEFAULT_CLUSTER_METHOD = "wcc";
    public static final String DEFAULT_EMBEDDING_FIELD = "embedding";

    private final int version;
    private final ScoringConfig scoringConfig;
    private final int pageSize;
    private final String edgeCollection;
    private final String edgeMethod;
    private final int edgeBatchSize;
    private final boolean bidirectionalEdges;
    private final int minClusterSize;
    private final String clusterMethod;
    private final String embeddingField;
    private final double annThreshold;
    private final int annLimit;
    private final boolean forceBruteForce;
    private final Node2VecParams node2VecParams;
    private final SafetyLimits safetyLimits;

    private LinkageConfig(Builder builder) {
        this.version = builder.version;
        this.scoringConfig = builder.scoring.build();
        this.pageSize = builder.pageSize;
        this.edgeCollection = builder.edgeCollection;
        this.edgeMethod = builder.edgeMethod;
        this.edgeBatchSize = builder.edgeBatchSize;
        this.bidirectionalEdges = builder.bidirectionalEdges;
        this.minClusterSize = builder.minClusterSize;
        this.clusterMethod = builder.clusterMethod;
        this.embeddingField = builder.embeddingField;
        this.annThreshold = builder.annThreshold;
        this.annLimit = builder.annLimit;
        this.forceBruteForce = builder.forceBruteForce;
        this.node2VecParams = new Node2VecParams(builder.dimensions, builder.walkLength, builder.numWalks,
                builder.windowSize, builder.seed, builder.returnParam, builder.inOutParam, builder.directed);
        this.safetyLimits = new SafetyLimits(builder.maxNodes, builder.warnNodesThreshold, builder.maxDimensions,
                builder.maxEdgesFetched, builder.warnEdgesThreshold);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LinkageConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a copy of this config with the given dotted-key overrides applied.
     *
     * @throws ConfigurationException on an unknown key, a value of the wrong type,
     *                                a version other than {@link #CURRENT_VERSION}, or an invalid result
     */
    public LinkageConfig withOverrides(Map<String, Object> overrides) {
        Builder builder = toBuilder();
        for (Map.Entry<String, Object> override : overrides.entrySet()) {
            builder.apply(override.getKey(), override.getValue());
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .version(version)
                .scoring(scoringConfig)
                .pageSize(pageSize)
                .edgeCollection(edgeCollection)
                .edgeMethod(edgeMethod)
                .edgeBatchSize(edgeBatchSize)
                .bidirectionalEdges(bidirectionalEdges)
                .minClusterSize(minClusterSize)
                .clusterMethod(clusterMethod)
                .embeddingField(embeddingField)
                .annThreshold(annThreshold)
                .annLimit(annLimit)
                .forceBruteForce(forceBruteForce)
                .node2VecParams(node2VecParams)
                .safetyLimits(safetyLimits);
    }

    public int getVersion() {
        return version;
    }

    public ScoringConfig getScoringConfig() {
        return scoringConfig;
    }

    public int getPageSize() {
        return pageSize;
    }

    public String getEdgeCollection() {
        return edgeCollection;
    }

    public String getEdgeMethod() {
        return edgeMethod;
    }

    public int getEdgeBatchSize() {
        return edgeBatchSize;
    }

    public boolean isBidirectionalEdges() {
        return bidirectionalEdges;
    }

    public int getMinClusterSize() {
        return minClusterSize;
    }

    public String getClusterMethod() {
        return clusterMethod;
    }

    public String getEmbeddingField() {
        return embeddingField;
    }

    public double getAnnThreshold() {
        return annThreshold;
    }

    public int getAnnLimit() {
        return annLimit;
    }

    public boolean isForceBruteForce() {
        return forceBruteForce;
    }

    public Node2VecParams getNode2VecParams() {
        return node2VecParams;
    }

    public SafetyLimits getSafetyLimits() {
        return safetyLimits;
    }

    @Override
    public String toString() {
        return "LinkageConfig{" +
                "version=" + version +
                ", scoring=" + scoringConfig +
                ", edgeCollection='" + edgeCollection + '\'' +
                ", edgeBatchSize=" + edgeBatchSize +
                ", minClusterSize=" + minClusterSize +
                ", annThreshold=" + annThreshold +
                ", annLimit=" + annLimit +
                ", node2vec=" + node2VecParams +
                '}';
    }

    public static class Builder {
        private int version = CURRENT_VERSION;
        private ScoringConfig.Builder scoring = ScoringConfig.defaults().toBuilder();
        private int pageSize = RecordStore.DEFAULT_PAGE_SIZE;
        private String edgeCollection = DEFAULT_EDGE_COLLECTION;
        private String edgeMethod = DEFAULT_EDGE_METHOD;
        private int edgeBatchSize = SimilarityEdgeService.DEFAULT_BATCH_SIZE;
        private boolean bidirectionalEdges = false;
        private int minClusterSize = WccClusteringService.DEFAULT_MIN_CLUSTER_SIZE;
        private String clusterMethod = DEFAULT_CLUSTER_METHOD;
        private String embeddingField = DEFAULT_EMBEDDING_FIELD;
        private double annThreshold = VectorQuery.DEFAULT_THRESHOLD;
        private int annLimit = VectorQuery.DEFAULT_LIMIT;
        private boolean forceBruteForce = false;

        private int dimensions;
        private int walkLength;
        private int numWalks;
        private int windowSize;
        private long seed;
        private double returnParam;
        private double inOutParam;
        private boolean directed;

        private int maxNodes;
        private int warnNodesThreshold;
        private int maxDimensions;
        private int maxEdgesFetched;
        private int warnEdgesThreshold;

        Builder() {
            node2VecParams(Node2VecParams.defaults());
            safetyLimits(SafetyLimits.defaults());
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder scoring(ScoringConfig scoringConfig) {
            this.scoring = scoringConfig.toBuilder();
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder edgeCollection(String edgeCollection) {
            this.edgeCollection = edgeCollection;
            return this;
        }

        public Builder edgeMethod(String edgeMethod) {
            this.edgeMethod = edgeMethod;
            return this;
        }

        public Builder edgeBatchSize(int edgeBatchSize) {
            this.edgeBatchSize = edgeBatchSize;
            return this;
        }

        public Builder bidirectionalEdges(boolean bidirectionalEdges) {
            this.bidirectionalEdges = bidirectionalEdges;
            return this;
        }

        public Builder minClusterSize(int minClusterSize) {
            this.minClusterSize = minClusterSize;
            return this;
        }

        public Builder clusterMethod(String clusterMethod) {
            this.clusterMethod = clusterMethod;
            return this;
        }

        public Builder embeddingField(String embeddingField) {
            this.embeddingField = embeddingField;
            return this;
        }

        public Builder annThreshold(double annThreshold) {
            this.annThreshold = annThreshold;
            return this;
        }

        public Builder annLimit(int annLimit) {
            this.annLimit = annLimit;
            return this;
        }

        public Builder forceBruteForce(boolean forceBruteForce) {
            this.forceBruteForce = forceBruteForce;
            return this;
        }

        public Builder node2VecParams(Node2VecParams params) {
            this.dimensions = params.dimensions();
            this.walkLength = params.walkLength();
            this.numWalks = params.numWalks();
            this.windowSize = params.windowSize();
            this.seed = params.seed();
            this.returnParam = params.returnParam();
            this.inOutParam = params.inOutParam();
            this.directed = params.directed();
            return this;
        }

        public Builder safetyLimits(SafetyLimits limits) {
            this.maxNodes = limits.maxNodes();
            this.warnNodesThreshold = limits.warnNodesThreshold();
            this.maxDimensions = limits.maxDimensions();
            this.maxEdgesFetched = limits.maxEdgesFetched();
            this.warnEdgesThreshold = limits.warnEdgesThreshold();
            return this;
        }

        Builder apply(String key, Object value) {
            if (key == null || value == null) {
                throw new ConfigurationException("Override key and value must not be null: " + key);
            }
            switch (key) {
                case "version" -> version = asInt(key, value);
                case "scoring.upperThreshold" -> scoring.upperThreshold(asDouble(key, value));
                case "scoring.lowerThreshold" -> scoring.lowerThreshold(asDouble(key, value));
                case "store.pageSize" -> pageSize = asInt(key, value);
                case "edges.collection" -> edgeCollection = value.toString();
                case "edges.method" -> edgeMethod = value.toString();
                case "edges.batchSize" -> edgeBatchSize = asInt(key, value);
                case "edges.bidirectional" -> bidirectionalEdges = asBoolean(key, value);
                case "clustering.minClusterSize" -> minClusterSize = asInt(key, value);
                case "clustering.method" -> clusterMethod = value.toString();
                case "ann.embeddingField" -> embeddingField = value.toString();
                case "ann.threshold" -> annThreshold = asDouble(key, value);
                case "ann.limit" -> annLimit = asInt(key, value);
                case "ann.forceBruteForce" -> forceBruteForce = asBoolean(key, value);
                case "node2vec.dimensions" -> dimensions = asInt(key, value);
                case "node2vec.walkLength" -> walkLength = asInt(key, value);
                case "node2vec.numWalks" -> numWalks = asInt(key, value);
                case "node2vec.windowSize" -> windowSize = asInt(key, value);
                case "node2vec.seed" -> seed = asLong(key, value);
                case "node2vec.returnParam" -> returnParam = asDouble(key, value);
                case "node2vec.inOutParam" -> inOutParam = asDouble(key, value);
                case "node2vec.directed" -> directed = asBoolean(key, value);
                case "limits.maxNodes" -> maxNodes = asInt(key, value);
                case "limits.warnNodesThreshold" -> warnNodesThreshold = asInt(key, value);
                case "limits.maxDimensions" -> maxDimensions = asInt(key, value);
                case "limits.maxEdgesFetched" -> maxEdgesFetched = asInt(key, value);
                case "limits.warnEdgesThreshold" -> warnEdgesThreshold = asInt(key, value);
                default -> throw new ConfigurationException("Unknown configuration key: " + key);
            }
            return this;
        }

        public LinkageConfig build() {
            if (version != CURRENT_VERSION) {
                throw new ConfigurationException(
                        "Unsupported config version " + version + " (expected " + CURRENT_VERSION + ")");
            }
            if (pageSize < 1) {
                throw new ConfigurationException("store.pageSize must be >= 1");
            }
            if (edgeBatchSize < 1) {
                throw new ConfigurationException("edges.batchSize must be >= 1");
            }
            if (minClusterSize < 2) {
                throw new ConfigurationException("clustering.minClusterSize must be >= 2");
            }
            if (annThreshold < 0.0 || annThreshold > 1.0) {
                throw new ConfigurationException("ann.threshold must be in [0, 1]");
            }
            if (annLimit < 1) {
                throw new ConfigurationException("ann.limit must be >= 1");
            }
            if (edgeMethod == null || edgeMethod.isBlank() || clusterMethod == null || clusterMethod.isBlank()) {
                throw new ConfigurationException("edges.method and clustering.method must not be blank");
            }
            try {
                InputSanitizer.validateCollectionName(edgeCollection);
                InputSanitizer.validateFieldName(embeddingField);
            } catch (ValidationException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
            return new LinkageConfig(this);
        }

        private static int asInt(String key, Object value) {
            long result = asLong(key, value);
            if (result < Integer.MIN_VALUE || result > Integer.MAX_VALUE) {
                throw new ConfigurationException(key + " is out of range: " + value);
            }
            return (int) result;
        }

        private static long asLong(String key, Object value) {
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                return ((Number) value).longValue();
            }
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
            }
        }

        private static double asDouble(String key, Object value) {
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " must be a number, got '" + value + "'", e);
            }
        }

        private static boolean asBoolean(String key, Object value) {
            if (value instanceof Boolean b) {
                return b;
            }
            String text = value.toString().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
            throw new ConfigurationException(key + " must be true or false, got '" + value + "'");
        }
    }
}

package com.entity.linkage.metrics;

import com.entity.linkage.core.model.MatchDecision;

import java.time.Duration;

/**
 * Interface for recording linkage metrics.
 * The default {@link NoOpMetricsService} does nothing, so components work
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordBlocking(String strategy, int candidatePairs, Duration duration);

    void incrementSkippedBlocks(String strategy, int count);

    void recordDecision(MatchDecision decision);

    void recordSimilarityScore(double score);

    void incrementScoringFailures(int count);

    void recordAnnQuery(String method);

    void incrementAnnFallback();

    void recordEdgeBatch(int size, boolean success);

    void recordClusterSize(int size);

    void recordEmbeddingDuration(int nodes, Duration duration);
}

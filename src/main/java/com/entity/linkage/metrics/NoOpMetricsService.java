package com.entity.linkage.metrics;

import com.entity.linkage.core.model.MatchDecision;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordBlocking(String strategy, int candidatePairs, Duration duration) {
    }

    @Override
    public void incrementSkippedBlocks(String strategy, int count) {
    }

    @Override
    public void recordDecision(MatchDecision decision) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void incrementScoringFailures(int count) {
    }

    @Override
    public void recordAnnQuery(String method) {
    }

    @Override
    public void incrementAnnFallback() {
    }

    @Override
    public void recordEdgeBatch(int size, boolean success) {
    }

    @Override
    public void recordClusterSize(int size) {
    }

    @Override
    public void recordEmbeddingDuration(int nodes, Duration duration) {
    }
}

package com.entity.linkage.metrics;

import com.entity.linkage.core.model.MatchDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linkage.blocking.duration} Timer (tag: strategy)</li>
 *   <li>{@code linkage.blocking.candidates} Counter (tag: strategy)</li>
 *   <li>{@code linkage.blocking.skipped} Counter (tag: strategy)</li>
 *   <li>{@code linkage.decision} Counter (tag: decision)</li>
 *   <li>{@code linkage.similarity.score} DistributionSummary</li>
 *   <li>{@code linkage.scoring.failures} Counter</li>
 *   <li>{@code linkage.ann.query} Counter (tag: method)</li>
 *   <li>{@code linkage.ann.fallback} Counter</li>
 *   <li>{@code linkage.edge.batch} DistributionSummary (tag: outcome)</li>
 *   <li>{@code linkage.cluster.size} DistributionSummary</li>
 *   <li>{@code linkage.embedding.duration} Timer</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary clusterSizeSummary;
    private final Counter scoringFailureCounter;
    private final Counter annFallbackCounter;
    private final Timer embeddingTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("linkage.similarity.score")
                .description("Distribution of Fellegi-Sunter scores")
                .register(registry);
        this.clusterSizeSummary = DistributionSummary.builder("linkage.cluster.size")
                .description("Distribution of cluster sizes")
                .register(registry);
        this.scoringFailureCounter = Counter.builder("linkage.scoring.failures")
                .description("Number of pairs that could not be scored")
                .register(registry);
        this.annFallbackCounter = Counter.builder("linkage.ann.fallback")
                .description("Native vector searches retried by brute force")
                .register(registry);
        this.embeddingTimer = Timer.builder("linkage.embedding.duration")
                .description("Duration of node2vec embedding runs")
                .register(registry);
    }

    @Override
    public void recordBlocking(String strategy, int candidatePairs, Duration duration) {
        timerCache.computeIfAbsent(strategy, k ->
                Timer.builder("linkage.blocking.duration")
                        .description("Duration of candidate generation")
                        .tag("strategy", strategy)
                        .register(registry)).record(duration);
        counter("candidates:" + strategy, "linkage.blocking.candidates", "strategy", strategy)
                .increment(candidatePairs);
    }

    @Override
    public void incrementSkippedBlocks(String strategy, int count) {
        counter("skipped:" + strategy, "linkage.blocking.skipped", "strategy", strategy).increment(count);
    }

    @Override
    public void recordDecision(MatchDecision decision) {
        counter("decision:" + decision.name(), "linkage.decision", "decision", decision.label()).increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void incrementScoringFailures(int count) {
        scoringFailureCounter.increment(count);
    }

    @Override
    public void recordAnnQuery(String method) {
        counter("ann:" + method, "linkage.ann.query", "method", method).increment();
    }

    @Override
    public void incrementAnnFallback() {
        annFallbackCounter.increment();
    }

    @Override
    public void recordEdgeBatch(int size, boolean success) {
        String outcome = success ? "success" : "failure";
        summaryCache.computeIfAbsent(outcome, k ->
                DistributionSummary.builder("linkage.edge.batch")
                        .description("Edge insert batch sizes")
                        .tag("outcome", outcome)
                        .register(registry)).record(size);
    }

    @Override
    public void recordClusterSize(int size) {
        clusterSizeSummary.record(size);
    }

    @Override
    public void recordEmbeddingDuration(int nodes, Duration duration) {
        embeddingTimer.record(duration);
    }

    private Counter counter(String cacheKey, String name, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(cacheKey, k ->
                Counter.builder(name)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}

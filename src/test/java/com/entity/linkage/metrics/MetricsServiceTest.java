package com.entity.linkage.metrics;

import com.entity.linkage.core.model.MatchDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            MetricsService noOp = NoOpMetricsService.INSTANCE;

            assertDoesNotThrow(() -> {
                noOp.recordBlocking("exact", 10, Duration.ofMillis(5));
                noOp.incrementSkippedBlocks("exact", 1);
                noOp.recordDecision(MatchDecision.MATCH);
                noOp.recordSimilarityScore(3.2);
                noOp.incrementScoringFailures(2);
                noOp.recordAnnQuery("brute_force");
                noOp.incrementAnnFallback();
                noOp.recordEdgeBatch(100, true);
                noOp.recordClusterSize(3);
                noOp.recordEmbeddingDuration(10, Duration.ofMillis(20));
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record blocking duration and candidates per strategy")
        void recordBlocking() {
            metrics.recordBlocking("exact", 10, Duration.ofMillis(150));
            metrics.recordBlocking("exact", 5, Duration.ofMillis(250));
            metrics.recordBlocking("lsh", 7, Duration.ofMillis(50));

            Timer timer = registry.find("linkage.blocking.duration").tag("strategy", "exact").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());

            Counter candidates = registry.find("linkage.blocking.candidates").tag("strategy", "exact").counter();
            assertNotNull(candidates);
            assertEquals(15.0, candidates.count());
        }

        @Test
        @DisplayName("Should count decisions by label")
        void recordDecision() {
            metrics.recordDecision(MatchDecision.MATCH);
            metrics.recordDecision(MatchDecision.MATCH);
            metrics.recordDecision(MatchDecision.NON_MATCH);

            Counter matches = registry.find("linkage.decision").tag("decision", "match").counter();
            assertNotNull(matches);
            assertEquals(2.0, matches.count());
            assertEquals(1.0, registry.find("linkage.decision").tag("decision", "non_match").counter().count());
        }

        @Test
        @DisplayName("Should split edge batches by outcome")
        void recordEdgeBatch() {
            metrics.recordEdgeBatch(1000, true);
            metrics.recordEdgeBatch(200, false);

            DistributionSummary success = registry.find("linkage.edge.batch").tag("outcome", "success").summary();
            assertNotNull(success);
            assertEquals(1000.0, success.totalAmount());
            assertEquals(1, registry.find("linkage.edge.batch").tag("outcome", "failure").summary().count());
        }

        @Test
        @DisplayName("Should track ANN queries and fallbacks")
        void annQueries() {
            metrics.recordAnnQuery("native_vector_search");
            metrics.recordAnnQuery("brute_force");
            metrics.incrementAnnFallback();

            assertEquals(1.0, registry.find("linkage.ann.query").tag("method", "brute_force").counter().count());
            assertEquals(1.0, registry.find("linkage.ann.fallback").counter().count());
        }

        @Test
        @DisplayName("Should record scores, cluster sizes and embedding runs")
        void summaries() {
            metrics.recordSimilarityScore(2.5);
            metrics.recordSimilarityScore(-1.5);
            metrics.recordClusterSize(4);
            metrics.incrementScoringFailures(3);
            metrics.recordEmbeddingDuration(100, Duration.ofSeconds(1));

            assertEquals(2, registry.find("linkage.similarity.score").summary().count());
            assertEquals(4.0, registry.find("linkage.cluster.size").summary().max());
            assertEquals(3.0, registry.find("linkage.scoring.failures").counter().count());
            assertEquals(1, registry.find("linkage.embedding.duration").timer().count());
        }
    }
}

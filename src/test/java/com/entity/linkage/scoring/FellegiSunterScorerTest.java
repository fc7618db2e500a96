package com.entity.linkage.scoring;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.CandidatePair;
import com.entity.linkage.core.model.MatchDecision;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.similarity.ComparisonMethod;
import com.entity.linkage.store.InMemoryRecordStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FellegiSunterScorerTest {

    private static final double LOG2_9 = Math.log(9.0) / Math.log(2.0);

    private static Record person(String id, String first, String last, String email, String phone, String city) {
        return Record.of(id, Map.of(
                "first_name", first,
                "last_name", last,
                "email", email,
                "phone", phone,
                "city", city));
    }

    private static ScoringConfig emailOnly() {
        return ScoringConfig.builder()
                .field("email", ComparisonMethod.EXACT, 0.9, 0.1, 1.0, 1.0)
                .build();
    }

    @Nested
    @DisplayName("Pair scoring")
    class PairScoring {
        private final FellegiSunterScorer scorer = new FellegiSunterScorer(ScoringConfig.defaults());

        @Test
        @DisplayName("identical records are a confident match")
        void identicalRecordsMatch() {
            Record a = person("1", "John", "Smith", "john@example.com", "555-0100", "Boston");
            Record b = person("2", "John", "Smith", "john@example.com", "555-0100", "Boston");

            SimilarityResult result = scorer.score(a, b, false);

            assertEquals(MatchDecision.MATCH, result.decision());
            assertTrue(result.isMatch());
            assertTrue(result.confidence() > 0.9, "confidence was " + result.confidence());
            assertEquals(7, result.fieldsCompared());
        }

        @Test
        @DisplayName("records disagreeing on every field are a non-match")
        void dissimilarRecordsDoNotMatch() {
            Record a = person("1", "John", "Smith", "john@example.com", "555-0100", "Boston");
            Record b = person("2", "Maria", "Garcia", "maria@other.org", "555-9999", "Denver");

            SimilarityResult result = scorer.score(a, b, false);

            assertEquals(MatchDecision.NON_MATCH, result.decision());
            assertEquals(0.0, result.confidence());
            assertTrue(result.score() < 0);
        }

        @Test
        @DisplayName("null records are rejected")
        void nullRecord() {
            Record a = person("1", "John", "Smith", "john@example.com", "555-0100", "Boston");
            assertThrows(IllegalArgumentException.class, () -> scorer.score(a, null, false));
        }
    }

    @Nested
    @DisplayName("Field contributions")
    class FieldContributions {
        private final FellegiSunterScorer scorer = new FellegiSunterScorer(emailOnly());

        @Test
        @DisplayName("agreement adds log2(m/u)")
        void agreement() {
            SimilarityResult result = scorer.score(
                    Record.of("1", Map.of("email", "a@x.com")),
                    Record.of("2", Map.of("email", "A@X.COM")), true);

            assertEquals(LOG2_9, result.score(), 1e-12);
            assertEquals(1, result.fields().size());
            FieldSimilarity detail = result.fields().get(0);
            assertTrue(detail.agreed());
            assertEquals("exact", detail.algorithm());
        }

        @Test
        @DisplayName("disagreement adds log2((1-m)/(1-u))")
        void disagreement() {
            SimilarityResult result = scorer.score(
                    Record.of("1", Map.of("email", "a@x.com")),
                    Record.of("2", Map.of("email", "b@x.com")), false);

            assertEquals(-LOG2_9, result.score(), 1e-12);
            assertEquals(MatchDecision.NON_MATCH, result.decision());
            assertTrue(result.fields().isEmpty());
        }

        @Test
        @DisplayName("missing or blank fields are excluded")
        void missingFieldsExcluded() {
            Map<String, Object> withNull = new HashMap<>();
            withNull.put("email", null);
            SimilarityResult result = scorer.score(
                    Record.of("1", withNull),
                    Record.of("2", Map.of("email", "  ")), false);

            assertEquals(0, result.fieldsCompared());
            assertEquals(0.0, result.score());
            assertEquals(MatchDecision.POSSIBLE_MATCH, result.decision());
            assertEquals(1.0 / 3.0, result.confidence(), 1e-12);
        }
    }

    @Nested
    @DisplayName("Batch scoring")
    class BatchScoring {
        private final FellegiSunterScorer scorer = new FellegiSunterScorer(emailOnly());

        @Test
        @DisplayName("a malformed pair is counted as failed and the batch continues")
        void malformedPair() {
            Record a = Record.of("1", Map.of("email", "a@x.com"));
            Record b = Record.of("2", Map.of("email", "a@x.com"));

            BatchScoringResult batch = scorer.computeBatchSimilarity(
                    Arrays.asList(new RecordPair(a, b), new RecordPair(a, null)), false);

            assertEquals(2, batch.totalPairs());
            assertEquals(1, batch.successfulPairs());
            assertEquals(1, batch.failedPairs());
            assertTrue(batch.hasFailures());
            assertEquals(SimilarityResult.round(LOG2_9), batch.averageScore());
            assertNotNull(batch.results().get(1).errorMessage());
        }

        @Test
        @DisplayName("null entries in the batch are failures")
        void nullPair() {
            BatchScoringResult batch = scorer.computeBatchSimilarity(Arrays.asList((RecordPair) null), false);
            assertEquals(1, batch.failedPairs());
            assertEquals(0.0, batch.averageScore());
        }

        @Test
        @DisplayName("candidate pairs are loaded from the store; missing records fail")
        void candidatePairs() {
            InMemoryRecordStore store = new InMemoryRecordStore("people")
                    .add(Record.of("1", Map.of("email", "a@x.com")))
                    .add(Record.of("2", Map.of("email", "a@x.com")));

            BatchScoringResult batch = scorer.computeBatchSimilarity(List.of(
                    CandidatePair.of("1", "2", "exact", "A@X.COM"),
                    CandidatePair.of("1", "9", "exact", "A@X.COM")), store, false);

            assertEquals(1, batch.successfulPairs());
            assertEquals(1, batch.failedPairs());
            assertTrue(batch.results().get(1).errorMessage().contains("9"));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("weight keys split into field and method")
        void fromKey() {
            FieldWeight weight = FieldWeight.fromKey("first_name_ngram", 0.85, 0.02, 0.7, 0.8);
            assertEquals("first_name", weight.field());
            assertEquals(ComparisonMethod.NGRAM, weight.method());
            assertEquals("first_name_ngram", weight.key());
        }

        @Test
        @DisplayName("m and u must lie strictly between 0 and 1")
        void probabilityBounds() {
            assertThrows(IllegalArgumentException.class,
                    () -> new FieldWeight("email", ComparisonMethod.EXACT, 1.0, 0.1, 1.0, 1.0));
            assertThrows(IllegalArgumentException.class,
                    () -> new FieldWeight("email", ComparisonMethod.EXACT, 0.9, 0.0, 1.0, 1.0));
        }

        @Test
        @DisplayName("empty weights, zero importance and inverted thresholds are rejected")
        void invalidConfigs() {
            assertThrows(ConfigurationException.class, () -> ScoringConfig.builder().build());
            assertThrows(ConfigurationException.class, () -> ScoringConfig.builder()
                    .field("email", ComparisonMethod.EXACT, 0.9, 0.1, 1.0, 0.0)
                    .build());
            assertThrows(ConfigurationException.class, () -> emailOnly().toBuilder()
                    .upperThreshold(-2.0)
                    .build());
        }

        @Test
        @DisplayName("default config carries ten field weights")
        void defaults() {
            ScoringConfig config = ScoringConfig.defaults();
            assertEquals(10, config.getFieldWeights().size());
            assertEquals(ScoringConfig.DEFAULT_UPPER_THRESHOLD, config.getUpperThreshold());
            assertEquals(ScoringConfig.DEFAULT_LOWER_THRESHOLD, config.getLowerThreshold());
        }
    }
}

package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.CandidatePair;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeyBasedBlockingStrategyTest {

    private InMemoryRecordStore store;
    private BlockingStrategies strategies;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore("people")
                .add(Record.of("p1", Map.of("last_name", "Smith", "city", "Boston", "zip", "02101")))
                .add(Record.of("p2", Map.of("last_name", "smith ", "city", "BOSTON", "zip", "02101")))
                .add(Record.of("p3", Map.of("last_name", "Smyth", "city", "Boston", "zip", "02102")))
                .add(Record.of("p4", Map.of("last_name", "Jones", "city", "Denver", "zip", "80201")))
                .add(Record.of("p5", Map.of("city", "Denver", "zip", "80201")));
        strategies = new BlockingStrategies(store);
    }

    private static Set<String> keys(List<CandidatePair> pairs) {
        Set<String> keys = new HashSet<>();
        for (CandidatePair pair : pairs) {
            assertTrue(keys.add(pair.pairKey()), "duplicate pair " + pair.pairKey());
        }
        return keys;
    }

    @Nested
    @DisplayName("Exact blocking")
    class Exact {

        @Test
        @DisplayName("values are compared trimmed and case-folded")
        void caseFolded() {
            BlockingStrategy strategy = strategies.create(ExactBlockingParams.of("last_name", "city"));

            List<CandidatePair> pairs = strategy.generateCandidates();

            assertEquals(Set.of("p1|p2"), keys(pairs));
            assertEquals("SMITH|BOSTON", pairs.get(0).blockingKey());
            assertEquals("exact", pairs.get(0).strategy());
        }

        @Test
        @DisplayName("a record missing a key field is not blocked")
        void missingField() {
            BlockingStrategy strategy = strategies.create(ExactBlockingParams.of("last_name", "zip"));

            assertEquals(Set.of("p1|p2"), keys(strategy.generateCandidates()));
        }

        @Test
        @DisplayName("computed fields take part in the key")
        void computedFields() {
            BlockingStrategy strategy = strategies.create(new ExactBlockingParams(List.of("city"),
                    List.of(ComputedField.prefix("zip", 4)), 2, 100, List.of()));

            // p1, p2, p3 share BOSTON|0210; p4, p5 share DENVER|8020
            assertEquals(Set.of("p1|p2", "p1|p3", "p2|p3", "p4|p5"), keys(strategy.generateCandidates()));
        }

        @Test
        @DisplayName("oversized blocks are skipped whole and counted")
        void oversizedBlocksSkipped() {
            BlockingStrategy strategy = strategies.create(new ExactBlockingParams(List.of("city"), List.of(),
                    2, 2, List.of()));

            List<CandidatePair> pairs = strategy.generateCandidates();

            assertEquals(Set.of("p4|p5"), keys(pairs));
            BlockingStatistics stats = strategy.getStatistics();
            assertEquals(1, stats.skippedOversizedBlocks());
            assertEquals(1, stats.blocksFormed());
            assertEquals(5, stats.recordsScanned());
            assertEquals(1, stats.candidatePairs());
        }

        @Test
        @DisplayName("filters run before blocking")
        void filters() {
            BlockingStrategy strategy = strategies.create(new ExactBlockingParams(List.of("city"), List.of(),
                    2, 100, List.of(RecordFilter.notNull("last_name"))));

            assertEquals(Set.of("p1|p2", "p1|p3", "p2|p3"), keys(strategy.generateCandidates()));
            assertEquals(4, strategy.getStatistics().recordsScanned());
        }

        @Test
        @DisplayName("no fields or invalid field names are configuration errors")
        void configurationErrors() {
            assertThrows(ConfigurationException.class,
                    () -> new ExactBlockingParams(List.of(), List.of(), 2, 100, List.of()));
            assertThrows(ConfigurationException.class, () -> ExactBlockingParams.of("city; DROP"));
            assertThrows(ConfigurationException.class,
                    () -> new ExactBlockingParams(List.of("city"), List.of(), 1, 100, List.of()));
        }

        @Test
        @DisplayName("identifiers containing the separator still form distinct pairs")
        void separatorInIdentifiers() {
            InMemoryRecordStore piped = new InMemoryRecordStore("people");
            for (String id : List.of("a", "a|b", "b|c", "c")) {
                piped.add(Record.of(id, Map.of("city", "Boston")));
            }
            BlockingStrategy strategy = new BlockingStrategies(piped).create(ExactBlockingParams.of("city"));

            List<CandidatePair> pairs = strategy.generateCandidates();

            Set<List<String>> ids = new HashSet<>();
            pairs.forEach(pair -> ids.add(pair.ids()));
            assertEquals(6, pairs.size());
            assertEquals(6, ids.size());
            assertTrue(ids.contains(List.of("a|b", "c")));
            assertTrue(ids.contains(List.of("a", "b|c")));
        }

        @Test
        @DisplayName("field values containing the separator do not share a block")
        void separatorInValues() {
            InMemoryRecordStore piped = new InMemoryRecordStore("people")
                    .add(Record.of("q1", Map.of("first", "a|b", "last", "c")))
                    .add(Record.of("q2", Map.of("first", "a", "last", "b|c")));
            BlockingStrategy strategy = new BlockingStrategies(piped).create(ExactBlockingParams.of("first", "last"));

            assertTrue(strategy.generateCandidates().isEmpty());
            assertEquals(2, strategy.getStatistics().details().get("distinct_keys"));
        }

        @Test
        @DisplayName("statistics report not-run before the first call")
        void notRunStatistics() {
            BlockingStrategy strategy = strategies.create(ExactBlockingParams.of("city"));
            assertEquals(0, strategy.getStatistics().candidatePairs());
            assertNull(strategy.getStatistics().timestamp());
        }
    }

    @Nested
    @DisplayName("N-gram blocking")
    class NGram {

        @Test
        @DisplayName("records sharing any trigram collide")
        void sharedTrigram() {
            BlockingStrategy strategy = strategies.create(NGramBlockingParams.ngrams("last_name", 3));

            // smith/smyth share no trigram; smith/smith share all
            assertEquals(Set.of("p1|p2"), keys(strategy.generateCandidates()));
        }

        @Test
        @DisplayName("prefix mode blocks on the leading characters")
        void prefixMode() {
            BlockingStrategy strategy = strategies.create(NGramBlockingParams.prefix("last_name", 2));

            assertEquals(Set.of("p1|p2", "p1|p3", "p2|p3"), keys(strategy.generateCandidates()));
            assertEquals("pfx:sm", strategy.generateCandidates().get(0).blockingKey());
        }

        @Test
        @DisplayName("normalization keeps letters and digits only")
        void normalization() {
            assertEquals("obrien42", NGramBlockingStrategy.normalize("O'Brien-42"));
        }
    }

    @Nested
    @DisplayName("Phonetic blocking")
    class Phonetic {

        @Test
        @DisplayName("names with equal Soundex codes collide")
        void soundex() {
            BlockingStrategy strategy = strategies.create(PhoneticBlockingParams.of("last_name"));

            List<CandidatePair> pairs = strategy.generateCandidates();

            assertEquals(Set.of("p1|p2", "p1|p3", "p2|p3"), keys(pairs));
            assertEquals("S530", pairs.get(0).blockingKey());
        }
    }
}

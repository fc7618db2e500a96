package com.entity.linkage.blocking;

import com.entity.linkage.blocking.GeographicBlockingParams.ZipRange;
import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.CandidatePair;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeographicBlockingStrategy Tests")
class GeographicBlockingStrategyTest {

    private InMemoryRecordStore store;
    private BlockingStrategies strategies;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore("companies")
                .add(Record.of("c1", Map.of("name", "Acme", "city", "Sioux Falls", "state", "SD", "zip", "57104")))
                .add(Record.of("c2", Map.of("name", "Acme Inc", "city", "sioux falls ", "state", "sd", "zip", "57104")))
                .add(Record.of("c3", Map.of("name", "Acme Corp", "city", "Rapid City", "state", "SD", "zip", "57701")))
                .add(Record.of("c4", Map.of("name", "Acme LLC", "city", "Sioux Falls", "state", "IA", "zip", "51104")))
                .add(Record.of("c5", Map.of("name", "Acme Ltd", "city", "Fargo", "zip", "57104")));
        strategies = new BlockingStrategies(store);
    }

    private static Set<String> keys(List<CandidatePair> pairs) {
        return pairs.stream().map(CandidatePair::pairKey).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Place levels")
    class Places {

        @Test
        @DisplayName("records in the same state share a block")
        void byState() {
            BlockingStrategy strategy = strategies.create(GeographicBlockingParams.byState("state"));

            List<CandidatePair> pairs = strategy.generateCandidates();

            assertEquals(Set.of("c1|c2", "c1|c3", "c2|c3"), keys(pairs));
            assertEquals("state:SD", pairs.get(0).blockingKey());
            assertEquals("geographic", pairs.get(0).strategy());
            assertEquals("state", strategy.getStatistics().details().get("blocking_type"));
        }

        @Test
        @DisplayName("a city name alone ignores the state")
        void byCity() {
            BlockingStrategy strategy = strategies.create(GeographicBlockingParams.byCity("city"));

            assertEquals(Set.of("c1|c2", "c1|c4", "c2|c4"), keys(strategy.generateCandidates()));
        }

        @Test
        @DisplayName("city and state must both match and both be present")
        void byCityAndState() {
            BlockingStrategy strategy = strategies.create(GeographicBlockingParams.byCityAndState("city", "state"));

            List<CandidatePair> pairs = strategy.generateCandidates();

            assertEquals(Set.of("c1|c2"), keys(pairs));
            assertEquals("city_state:SIOUX FALLS|SD", pairs.get(0).blockingKey());
            assertEquals("city_state", strategy.getStatistics().details().get("blocking_type"));
        }

        @Test
        @DisplayName("record filters apply before blocking")
        void filters() {
            BlockingStrategy strategy = strategies.create(GeographicBlockingParams.byState("state")
                    .withFilters(List.of(RecordFilter.equalTo("zip", "57104"))));

            assertEquals(Set.of("c1|c2"), keys(strategy.generateCandidates()));
        }
    }

    @Nested
    @DisplayName("ZIP levels")
    class Zips {

        @Test
        @DisplayName("only codes inside a range are blocked, on the full code")
        void zipRanges() {
            BlockingStrategy strategy = strategies.create(
                    GeographicBlockingParams.byZipRanges("zip", new ZipRange("570", "577")));

            List<CandidatePair> pairs = strategy.generateCandidates();

            assertEquals(Set.of("c1|c2", "c1|c5", "c2|c5"), keys(pairs));
            assertTrue(pairs.stream().allMatch(pair -> pair.blockingKey().equals("zip:57104")));
            assertEquals(5, strategy.getStatistics().recordsScanned());
        }

        @Test
        @DisplayName("bounds compare on their own length")
        void rangeBounds() {
            ZipRange range = new ZipRange("570", "577");

            assertTrue(range.contains("57001"));
            assertTrue(range.contains("57799"));
            assertFalse(range.contains("56999"));
            assertFalse(range.contains("57800"));
            assertFalse(range.contains("51104"));
        }

        @Test
        @DisplayName("a record outside every range is dropped")
        void outsideRanges() {
            BlockingStrategy strategy = strategies.create(
                    GeographicBlockingParams.byZipRanges("zip", new ZipRange("510", "519")));

            assertTrue(strategy.generateCandidates().isEmpty());
        }

        @Test
        @DisplayName("the prefix groups nearby codes")
        void zipPrefix() {
            BlockingStrategy strategy = strategies.create(GeographicBlockingParams.byZipPrefix("zip", 2));

            List<CandidatePair> pairs = strategy.generateCandidates();

            assertEquals(Set.of("c1|c2", "c1|c3", "c1|c5", "c2|c3", "c2|c5", "c3|c5"), keys(pairs));
            assertEquals("zip_prefix:57", pairs.get(0).blockingKey());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("each level requires its fields")
        void requiredFields() {
            assertThrows(ConfigurationException.class, () -> GeographicBlockingParams.byState(null));
            assertThrows(ConfigurationException.class, () -> GeographicBlockingParams.byCityAndState("city", " "));
            assertThrows(ConfigurationException.class, () -> GeographicBlockingParams.byZipPrefix("", 3));
        }

        @Test
        @DisplayName("ZIP range blocking requires ranges")
        void rangesRequired() {
            assertThrows(ConfigurationException.class, () -> GeographicBlockingParams.byZipRanges("zip"));
            assertThrows(ConfigurationException.class, () -> new ZipRange("570", ""));
        }

        @Test
        @DisplayName("rejects invalid prefix lengths and field names")
        void invalidValues() {
            assertThrows(ConfigurationException.class, () -> GeographicBlockingParams.byZipPrefix("zip", 0));
            assertThrows(ConfigurationException.class, () -> GeographicBlockingParams.byState("state; DROP"));
        }
    }
}

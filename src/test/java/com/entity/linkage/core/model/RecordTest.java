package com.entity.linkage.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordTest {

    @Nested
    @DisplayName("Record")
    class Records {

        @Test
        @DisplayName("vectors are read from arrays and number lists")
        void vectors() {
            assertArrayEquals(new double[]{1.0, 2.0}, Record.toVector(new double[]{1.0, 2.0}));
            assertArrayEquals(new double[]{0.5, 2.0}, Record.toVector(new float[]{0.5f, 2.0f}));
            assertArrayEquals(new double[]{1.0, 3.0}, Record.toVector(List.of(1, 3.0)));
            assertNull(Record.toVector(List.of(1.0, "x")));
            assertNull(Record.toVector("1,2"));
        }

        @Test
        @DisplayName("null field values are kept but reported absent")
        void nullFields() {
            Map<String, Object> fields = new HashMap<>();
            fields.put("email", null);
            fields.put("age", 41);
            Record record = Record.of("1", fields);

            assertFalse(record.has("email"));
            assertNull(record.getString("email"));
            assertEquals("41", record.getString("age"));
            assertEquals("x", record.withField("email", "x").getString("email"));
            assertNull(record.getString("email"));
        }

        @Test
        @DisplayName("a blank id is rejected")
        void blankId() {
            assertThrows(IllegalArgumentException.class, () -> Record.of(" ", Map.of()));
        }
    }

    @Nested
    @DisplayName("CandidatePair")
    class Pairs {

        @Test
        @DisplayName("identifiers are stored in canonical order")
        void canonicalOrder() {
            CandidatePair pair = CandidatePair.of("b", "a", "exact", "K");

            assertEquals("a", pair.leftId());
            assertEquals("b", pair.rightId());
            assertEquals(CandidatePair.of("a", "b", "ngram", "X").pairKey(), pair.pairKey());
        }

        @Test
        @DisplayName("self pairs are rejected")
        void selfPair() {
            assertThrows(IllegalArgumentException.class, () -> CandidatePair.of("a", "a", "exact", "K"));
        }
    }

    @Nested
    @DisplayName("RecordFilter")
    class Filters {

        private final Record record = Record.of("1", Map.of("city", "Boston", "age", 41, "zip", "02101"));

        @Test
        @DisplayName("operators compare numbers numerically and others as strings")
        void operators() {
            assertTrue(RecordFilter.equalTo("age", 41.0).test(record));
            assertTrue(RecordFilter.in("city", List.of("Boston", "Denver")).test(record));
            assertTrue(RecordFilter.range("age", 18, 65).test(record));
            assertFalse(RecordFilter.range("city", 18, 65).test(record));
            assertTrue(RecordFilter.minLength("zip", 5).test(record));
            assertTrue(new RecordFilter("zip", RecordFilter.Operator.REGEX, "^021").test(record));
            assertTrue(new RecordFilter("city", RecordFilter.Operator.CONTAINS, "ost").test(record));
        }

        @Test
        @DisplayName("a missing field fails every operator except NOT_EQUAL")
        void missingField() {
            assertFalse(RecordFilter.notNull("email").test(record));
            assertFalse(RecordFilter.equalTo("email", "x").test(record));
            assertTrue(new RecordFilter("email", RecordFilter.Operator.NOT_EQUAL, "x").test(record));
        }

        @Test
        @DisplayName("blank strings fail NOT_NULL")
        void blank() {
            assertFalse(RecordFilter.notNull("name").test(Record.of("2", Map.of("name", "  "))));
            assertTrue(RecordFilter.all(List.of(), record));
        }

        @Test
        @DisplayName("operands are checked when the filter is built")
        void invalidOperands() {
            assertThrows(IllegalArgumentException.class,
                    () -> new RecordFilter("age", RecordFilter.Operator.RANGE, List.of(1)));
            assertThrows(IllegalArgumentException.class,
                    () -> new RecordFilter("city", RecordFilter.Operator.IN, "Boston"));
            assertThrows(IllegalArgumentException.class, () -> RecordFilter.equalTo("city", null));
        }
    }
}

package com.entity.linkage.core.model;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scalar pre-filter applied to records before they take part in blocking
 * or vector search.
 *
 * @param field    the field the filter reads
 * @param operator the comparison operator
 * @param value    operand (collection for IN, two-element list for RANGE)
 */
public record RecordFilter(String field, Operator operator, Object value) {

    public enum Operator {
        NOT_NULL, EQUALS, NOT_EQUAL, IN, RANGE, MIN_LENGTH, MAX_LENGTH, CONTAINS, REGEX
    }

    public RecordFilter {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        if (operator != Operator.NOT_NULL && value == null) {
            throw new IllegalArgumentException("Filter " + operator + " on '" + field + "' requires a value");
        }
        if (operator == Operator.IN && !(value instanceof Collection<?>)) {
            throw new IllegalArgumentException("IN filter requires a collection value");
        }
        if (operator == Operator.RANGE && !(value instanceof List<?> bounds && bounds.size() == 2)) {
            throw new IllegalArgumentException("RANGE filter requires a [min, max] list");
        }
        if ((operator == Operator.MIN_LENGTH || operator == Operator.MAX_LENGTH)
                && !(value instanceof Number)) {
            throw new IllegalArgumentException(operator + " filter requires a numeric value");
        }
        if (operator == Operator.IN) {
            value = Set.copyOf((Collection<?>) value);
        }
        if (operator == Operator.REGEX) {
            value = Pattern.compile(value.toString());
        }
    }

    public static RecordFilter notNull(String field) {
        return new RecordFilter(field, Operator.NOT_NULL, null);
    }

    public static RecordFilter equalTo(String field, Object value) {
        return new RecordFilter(field, Operator.EQUALS, value);
    }

    public static RecordFilter in(String field, Collection<?> values) {
        return new RecordFilter(field, Operator.IN, values);
    }

    public static RecordFilter range(String field, Number min, Number max) {
        return new RecordFilter(field, Operator.RANGE, List.of(min, max));
    }

    public static RecordFilter minLength(String field, int length) {
        return new RecordFilter(field, Operator.MIN_LENGTH, length);
    }

    /**
     * Tests a record against this filter. A missing value fails every
     * operator except NOT_EQUAL.
     */
    public boolean test(Record record) {
        Object actual = record.get(field);
        if (actual == null) {
            return operator == Operator.NOT_EQUAL;
        }
        return switch (operator) {
            case NOT_NULL -> !(actual instanceof String s) || !s.isBlank();
            case EQUALS -> valuesEqual(actual, value);
            case NOT_EQUAL -> !valuesEqual(actual, value);
            case IN -> ((Set<?>) value).stream().anyMatch(v -> valuesEqual(actual, v));
            case RANGE -> inRange(actual, (List<?>) value);
            case MIN_LENGTH -> actual.toString().length() >= ((Number) value).intValue();
            case MAX_LENGTH -> actual.toString().length() <= ((Number) value).intValue();
            case CONTAINS -> actual.toString().contains(value.toString());
            case REGEX -> ((Pattern) value).matcher(actual.toString()).find();
        };
    }

    /**
     * Returns true when the record passes every filter in the list.
     */
    public static boolean all(List<RecordFilter> filters, Record record) {
        for (RecordFilter filter : filters) {
            if (!filter.test(record)) {
                return false;
            }
        }
        return true;
    }

    private static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return Double.compare(na.doubleValue(), nb.doubleValue()) == 0;
        }
        return a.toString().equals(b.toString());
    }

    private static boolean inRange(Object actual, List<?> bounds) {
        if (!(actual instanceof Number number)) {
            return false;
        }
        double v = number.doubleValue();
        double min = ((Number) bounds.get(0)).doubleValue();
        double max = ((Number) bounds.get(1)).doubleValue();
        return v >= min && v <= max;
    }
}

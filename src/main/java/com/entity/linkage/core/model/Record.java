package com.entity.linkage.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A record held by the external store: an identifier plus an open map of
 * named field values. Vectors may be stored as {@code double[]},
 * {@code float[]} or a list of numbers.
 *
 * @param id     the record identifier
 * @param fields the field values (may contain null values)
 */
public record Record(String id, Map<String, Object> fields) {

    public Record {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Record id must not be null or blank");
        }
        fields = fields != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
                : Map.of();
    }

    public static Record of(String id, Map<String, Object> fields) {
        return new Record(id, fields);
    }

    /**
     * Returns the raw value of a field, or null when absent.
     */
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    /**
     * Returns the string form of a field value, or null when absent.
     */
    public String getString(String field) {
        Object value = fields.get(field);
        return value != null ? value.toString() : null;
    }

    /**
     * Returns the field value as a vector, or null when absent or not numeric.
     */
    public double[] getVector(String field) {
        return toVector(fields.get(field));
    }

    /**
     * Returns a copy of this record with one field replaced.
     */
    public Record withField(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new Record(id, copy);
    }

    /**
     * Converts a stored vector representation into a {@code double[]}.
     */
    public static double[] toVector(Object value) {
        if (value instanceof double[] doubles) {
            return doubles.clone();
        }
        if (value instanceof float[] floats) {
            double[] result = new double[floats.length];
            for (int i = 0; i < floats.length; i++) {
                result[i] = floats[i];
            }
            return result;
        }
        if (value instanceof List<?> list) {
            double[] result = new double[list.size()];
            for (int i = 0; i < list.size(); i++) {
                if (!(list.get(i) instanceof Number number)) {
                    return null;
                }
                result[i] = number.doubleValue();
            }
            return result;
        }
        return null;
    }
}

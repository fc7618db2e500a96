package com.entity.linkage.blocking;

import com.entity.linkage.core.model.Record;
import com.entity.linkage.similarity.SoundexEncoder;

import java.util.Locale;

/**
 * A value derived from a record field and used as part of an exact blocking key.
 */
public record ComputedField(String sourceField, Kind kind, int length) {

    public enum Kind {
        /** The first {@code length} characters, upper-cased. */
        PREFIX,
        /** The value length divided by {@code length} (a length bucket). */
        LENGTH_BUCKET,
        /** The Soundex code of the value. */
        SOUNDEX
    }

    public ComputedField {
        if (sourceField == null || kind == null) {
            throw new IllegalArgumentException("sourceField and kind are required");
        }
        if (kind != Kind.SOUNDEX && length < 1) {
            throw new IllegalArgumentException(kind + " requires length >= 1");
        }
    }

    public static ComputedField prefix(String field, int length) {
        return new ComputedField(field, Kind.PREFIX, length);
    }

    public static ComputedField soundex(String field) {
        return new ComputedField(field, Kind.SOUNDEX, 0);
    }

    /**
     * Computes the value, or null when the source field is missing.
     */
    public String apply(Record record) {
        String value = record.getString(sourceField);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim().toUpperCase(Locale.ROOT);
        return switch (kind) {
            case PREFIX -> trimmed.substring(0, Math.min(length, trimmed.length()));
            case LENGTH_BUCKET -> Integer.toString(trimmed.length() / length);
            case SOUNDEX -> SoundexEncoder.encode(trimmed);
        };
    }

    public String name() {
        return sourceField + "_" + kind.name().toLowerCase(Locale.ROOT);
    }
}

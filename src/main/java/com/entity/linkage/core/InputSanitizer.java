package com.entity.linkage.core;

import com.entity.linkage.core.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Input validation utility for linkage operations.
 * Collection, label and field names end up inside generated queries,
 * so they are restricted to a safe identifier alphabet.
 */
public final class InputSanitizer {

    /** Maximum allowed length for collection, label and field names. */
    public static final int MAX_NAME_LENGTH = 256;

    /** Maximum allowed length for record identifiers. */
    public static final int MAX_RECORD_ID_LENGTH = 1000;

    /** Maximum allowed length for query string values. */
    public static final int MAX_QUERY_VALUE_LENGTH = 4000;

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a collection or graph label name.
     *
     * @param name the collection name
     * @throws ValidationException if the name is invalid
     */
    public static void validateCollectionName(String name) {
        validateName(name, "Collection name");
    }

    /**
     * Validates a record field name.
     *
     * @param name the field name
     * @throws ValidationException if the name is invalid
     */
    public static void validateFieldName(String name) {
        validateName(name, "Field name");
    }

    /**
     * Validates a record identifier.
     * Rejects null, blank, overly long, or control-character-containing identifiers.
     *
     * @param id the record identifier
     * @throws ValidationException if the identifier is invalid
     */
    public static void validateRecordId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Record id must not be null or blank");
        }
        if (id.length() > MAX_RECORD_ID_LENGTH) {
            throw new ValidationException(
                    "Record id exceeds maximum length of " + MAX_RECORD_ID_LENGTH +
                            " characters (was " + id.length() + ")");
        }
        if (containsControlCharacters(id)) {
            throw new ValidationException("Record id must not contain control characters");
        }
    }

    /**
     * Validates a string value for safe use in graph queries.
     *
     * @param value the string value
     * @throws ValidationException if the value exceeds the maximum length
     */
    public static void sanitizeForQuery(String value) {
        if (value != null && value.length() > MAX_QUERY_VALUE_LENGTH) {
            throw new ValidationException(
                    "Value exceeds maximum query string length of " + MAX_QUERY_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
    }

    private static void validateName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(what + " must not be null or blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException(
                    what + " exceeds maximum length of " + MAX_NAME_LENGTH + " characters");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new ValidationException(
                    what + " must start with a letter and contain only letters, digits and underscores, " +
                            "got: '" + name + "'");
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}

package com.entity.linkage.core;

import com.entity.linkage.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputSanitizer validation utility.
 */
class InputSanitizerTest {

    // ========== validateFieldName ==========

    @Test
    void validateFieldName_rejectsNullAndBlank() {
        assertThrows(ValidationException.class, () -> InputSanitizer.validateFieldName(null));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateFieldName("  "));
    }

    @Test
    void validateFieldName_rejectsQueryCharacters() {
        assertThrows(ValidationException.class, () -> InputSanitizer.validateFieldName("name}) DETACH DELETE"));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateFieldName("last-name"));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateFieldName("1st"));
    }

    @Test
    void validateFieldName_acceptsIdentifiers() {
        assertDoesNotThrow(() -> InputSanitizer.validateFieldName("last_name"));
        assertDoesNotThrow(() -> InputSanitizer.validateFieldName("embedding_node2vec"));
    }

    @Test
    void validateCollectionName_rejectsOverMaxLength() {
        String longName = "a".repeat(InputSanitizer.MAX_NAME_LENGTH + 1);
        assertThrows(ValidationException.class, () -> InputSanitizer.validateCollectionName(longName));
        assertDoesNotThrow(() -> InputSanitizer.validateCollectionName("a".repeat(InputSanitizer.MAX_NAME_LENGTH)));
    }

    // ========== validateRecordId ==========

    @Test
    void validateRecordId_rejectsControlCharacters() {
        assertThrows(ValidationException.class, () -> InputSanitizer.validateRecordId("id\u0000x"));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateRecordId("id\u007F"));
    }

    @Test
    void validateRecordId_acceptsFreeText() {
        assertDoesNotThrow(() -> InputSanitizer.validateRecordId("people/12345"));
        assertDoesNotThrow(() -> InputSanitizer.validateRecordId("Société Générale #4"));
    }

    @Test
    void sanitizeForQuery_rejectsOverMaxLength() {
        assertThrows(ValidationException.class,
                () -> InputSanitizer.sanitizeForQuery("x".repeat(InputSanitizer.MAX_QUERY_VALUE_LENGTH + 1)));
        assertDoesNotThrow(() -> InputSanitizer.sanitizeForQuery(null));
    }
}

package com.entity.linkage.core.exception;

/**
 * Thrown when an identifier, collection name or field name is invalid.
 */
public class ValidationException extends LinkageException {

    public ValidationException(String message) {
        super(message);
    }
}

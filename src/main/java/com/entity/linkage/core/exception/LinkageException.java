package com.entity.linkage.core.exception;

/**
 * Base runtime exception for record linkage failures.
 */
public class LinkageException extends RuntimeException {

    public LinkageException(String message) {
        super(message);
    }

    public LinkageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.entity.linkage.core.exception;

/**
 * Wraps a failure reported by the backing record or graph store.
 */
public class StorageException extends LinkageException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

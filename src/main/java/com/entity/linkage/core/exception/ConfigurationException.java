package com.entity.linkage.core.exception;

/**
 * Thrown when a component is constructed with an invalid configuration,
 * for example a blocking strategy without blocking fields or a weight set
 * whose weights are all zero. Always raised at construction time.
 */
public class ConfigurationException extends LinkageException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

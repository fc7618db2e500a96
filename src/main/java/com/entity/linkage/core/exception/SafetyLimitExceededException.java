package com.entity.linkage.core.exception;

/**
 * Thrown when a computation would exceed a configured hard safety limit.
 * The offending limit is named so callers can raise it deliberately;
 * inputs are never truncated to fit.
 */
public class SafetyLimitExceededException extends LinkageException {

    private final String limitName;
    private final long limit;
    private final long actual;

    public SafetyLimitExceededException(String limitName, long limit, long actual) {
        super("Safety limit '" + limitName + "' exceeded: " + actual + " > " + limit);
        this.limitName = limitName;
        this.limit = limit;
        this.actual = actual;
    }

    public String getLimitName() {
        return limitName;
    }

    public long getLimit() {
        return limit;
    }

    public long getActual() {
        return actual;
    }
}

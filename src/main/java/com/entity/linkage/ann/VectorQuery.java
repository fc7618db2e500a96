package com.entity.linkage.ann;

import com.entity.linkage.core.model.RecordFilter;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of a single similarity search. Exactly one of a query vector
 * or a query record key must be set.
 */
public final class VectorQuery {

    public static final double DEFAULT_THRESHOLD = 0.7;
    public static final int DEFAULT_LIMIT = 20;

    private final double[] queryVector;
    private final String queryDocKey;
    private final double threshold;
    private final int limit;
    private final boolean excludeSelf;
    private final String blockingField;
    private final Object blockingValue;
    private final List<RecordFilter> filters;

    private VectorQuery(Builder builder) {
        this.queryVector = builder.queryVector;
        this.queryDocKey = builder.queryDocKey;
        this.threshold = builder.threshold;
        this.limit = builder.limit;
        this.excludeSelf = builder.excludeSelf;
        this.blockingField = builder.blockingField;
        this.blockingValue = builder.blockingValue;
        this.filters = List.copyOf(builder.filters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public double[] getQueryVector() {
        return queryVector != null ? queryVector.clone() : null;
    }

    public String getQueryDocKey() {
        return queryDocKey;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getLimit() {
        return limit;
    }

    public boolean isExcludeSelf() {
        return excludeSelf;
    }

    public String getBlockingField() {
        return blockingField;
    }

    public Object getBlockingValue() {
        return blockingValue;
    }

    public List<RecordFilter> getFilters() {
        return filters;
    }

    public static class Builder {
        private double[] queryVector;
        private String queryDocKey;
        private double threshold = DEFAULT_THRESHOLD;
        private int limit = DEFAULT_LIMIT;
        private boolean excludeSelf = true;
        private String blockingField;
        private Object blockingValue;
        private final List<RecordFilter> filters = new ArrayList<>();

        public Builder queryVector(double[] queryVector) {
            this.queryVector = queryVector != null ? queryVector.clone() : null;
            return this;
        }

        public Builder queryDocKey(String queryDocKey) {
            this.queryDocKey = queryDocKey;
            return this;
        }

        public Builder threshold(double threshold) {
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be in [0, 1]");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 1) {
                throw new IllegalArgumentException("limit must be >= 1");
            }
            this.limit = limit;
            return this;
        }

        public Builder excludeSelf(boolean excludeSelf) {
            this.excludeSelf = excludeSelf;
            return this;
        }

        public Builder blocking(String field, Object value) {
            this.blockingField = field;
            this.blockingValue = value;
            return this;
        }

        public Builder filter(RecordFilter filter) {
            this.filters.add(filter);
            return this;
        }

        public VectorQuery build() {
            if ((queryVector == null) == (queryDocKey == null)) {
                throw new IllegalArgumentException("Exactly one of queryVector or queryDocKey must be provided");
            }
            return new VectorQuery(this);
        }
    }
}

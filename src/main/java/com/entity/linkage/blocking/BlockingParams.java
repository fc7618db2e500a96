package com.entity.linkage.blocking;

import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * Typed parameters of one blocking strategy variant. Implementations validate
 * themselves on construction and throw
 * {@link com.entity.linkage.core.exception.ConfigurationException} when invalid.
 */
public interface BlockingParams {

    BlockingStrategyType type();

    /**
     * Filters a record must pass before it is blocked.
     */
    List<RecordFilter> filters();
}

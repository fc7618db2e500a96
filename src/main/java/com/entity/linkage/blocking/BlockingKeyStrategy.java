package com.entity.linkage.blocking;

import com.entity.linkage.core.model.Record;

import java.util.Set;

/**
 * Generates blocking keys for a record. Records sharing at least one key
 * land in the same block.
 */
public interface BlockingKeyStrategy {

    /**
     * Generates the blocking keys of a record.
     *
     * @param record the record
     * @return set of blocking keys (never null, empty when the record cannot be blocked)
     */
    Set<String> generateKeys(Record record);
}

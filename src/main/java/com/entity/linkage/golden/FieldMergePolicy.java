package com.entity.linkage.golden;

import com.entity.linkage.core.model.Record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consolidates the fields of a cluster's member records into one set of values.
 */
public interface FieldMergePolicy {

    MergedFields merge(List<Record> members);

    /**
     * Consolidated values plus, per field, the members that supplied them.
     */
    record MergedFields(Map<String, Object> values, Map<String, List<String>> provenance) {
        public MergedFields {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
            provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
        }
    }
}

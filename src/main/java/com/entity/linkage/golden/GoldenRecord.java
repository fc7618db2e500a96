package com.entity.linkage.golden;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical merged representation of a resolved cluster.
 *
 * @param key        deterministic key derived from the sorted member ids
 * @param memberIds  the cluster members, sorted
 * @param fields     consolidated field values
 * @param provenance per field, the members that supplied the chosen value
 * @param runId      the run that last wrote this record
 * @param method     clustering method tag
 * @param updatedAt  last write time
 */
public record GoldenRecord(String key, List<String> memberIds, Map<String, Object> fields,
                           Map<String, List<String>> provenance, String runId, String method,
                           Instant updatedAt) {

    public GoldenRecord {
        Objects.requireNonNull(key, "key must not be null");
        memberIds = List.copyOf(memberIds);
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        provenance = provenance != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(provenance))
                : Map.of();
    }
}

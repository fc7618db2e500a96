package com.entity.linkage.core.model;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A connected component of matched records.
 * Members are deduplicated and sorted.
 */
public record Cluster(String id, List<String> members) {

    public Cluster {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(members, "members must not be null");
        members = List.copyOf(new TreeSet<>(members));
    }

    public int size() {
        return members.size();
    }

    public boolean contains(String recordId) {
        return members.contains(recordId);
    }
}

package com.entity.linkage.cluster;

import java.util.List;

/**
 * Problems found when checking clusters against their edges.
 */
public record ClusterValidationReport(List<String> issues) {

    public ClusterValidationReport {
        issues = List.copyOf(issues);
    }

    public boolean isValid() {
        return issues.isEmpty();
    }
}

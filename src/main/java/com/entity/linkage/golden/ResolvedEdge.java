package com.entity.linkage.golden;

/**
 * Links a member record to the golden record it resolved to.
 */
public record ResolvedEdge(String key, String memberId, String goldenKey, String runId) {
}

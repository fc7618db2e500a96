package com.entity.linkage.core.model;

/**
 * Fellegi-Sunter classification of a scored record pair.
 */
public enum MatchDecision {
    /** Score at or above the upper threshold. */
    MATCH("match"),

    /** Score between the thresholds; needs external review. */
    POSSIBLE_MATCH("possible_match"),

    /** Score at or below the lower threshold. */
    NON_MATCH("non_match");

    private final String label;

    MatchDecision(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

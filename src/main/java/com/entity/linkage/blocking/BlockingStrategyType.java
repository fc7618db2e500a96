package com.entity.linkage.blocking;

/**
 * Tag of each blocking strategy variant.
 */
public enum BlockingStrategyType {
    EXACT("exact"),
    NGRAM("ngram"),
    PHONETIC("phonetic"),
    SORTED_NEIGHBORHOOD("sorted_neighborhood"),
    LSH("lsh"),
    VECTOR("vector"),
    GEOGRAPHIC("geographic"),
    GRAPH_TRAVERSAL("graph_traversal"),
    COMPOSITE("composite");

    private final String label;

    BlockingStrategyType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

package com.entity.linkage.ann;

/**
 * How a vector search was executed. Every search result carries the tag.
 */
public enum SearchMethod {
    NATIVE("native_vector_search"),
    BRUTE_FORCE("brute_force");

    private final String tag;

    SearchMethod(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

package com.entity.linkage.store;

import java.util.List;

/**
 * A cursor-based page of records. The cursor is the identifier of the last
 * record on the page; records are ordered by identifier.
 *
 * @param content    the content of this page
 * @param nextCursor the cursor for fetching the next page, or null if no more
 * @param hasMore    whether there are more results after this page
 * @param <T>        the element type
 */
public record CursorPage<T>(List<T> content, String nextCursor, boolean hasMore) {

    public CursorPage {
        content = content != null ? List.copyOf(content) : List.of();
    }

    public int size() {
        return content.size();
    }

    public boolean hasContent() {
        return !content.isEmpty();
    }

    public static <T> CursorPage<T> empty() {
        return new CursorPage<>(List.of(), null, false);
    }
}

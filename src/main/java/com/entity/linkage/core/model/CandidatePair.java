package com.entity.linkage.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unordered pair of record identifiers emitted by a blocking strategy.
 * Identifiers are stored in canonical (sorted) order, so two pairs with equal
 * {@link #ids()} describe the same comparison.
 *
 * @param leftId      the smaller identifier
 * @param rightId     the larger identifier
 * @param strategy    name of the strategy that produced the pair
 * @param blockingKey the block key both records shared
 * @param metadata    strategy-specific details (similarity, hash table...)
 */
public record CandidatePair(String leftId, String rightId, String strategy,
                            String blockingKey, Map<String, Object> metadata) {

    public CandidatePair {
        Objects.requireNonNull(leftId, "leftId must not be null");
        Objects.requireNonNull(rightId, "rightId must not be null");
        if (leftId.equals(rightId)) {
            throw new IllegalArgumentException("A candidate pair needs two distinct records: " + leftId);
        }
        if (leftId.compareTo(rightId) > 0) {
            String tmp = leftId;
            leftId = rightId;
            rightId = tmp;
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static CandidatePair of(String a, String b, String strategy, String blockingKey) {
        return new CandidatePair(a, b, strategy, blockingKey, Map.of());
    }

    /**
     * Identity of the unordered pair regardless of the producing strategy.
     */
    public List<String> ids() {
        return List.of(leftId, rightId);
    }

    /**
     * Readable {@code left|right} label for logs. Identifiers may contain the
     * separator, so use {@link #ids()} to tell pairs apart.
     */
    public String pairKey() {
        return leftId + "|" + rightId;
    }
}

package com.entity.linkage.scoring;

/**
 * Outcome of scoring a single pair: either a result or the reason it failed.
 */
public record PairScore(int pairIndex, String leftId, String rightId,
                        SimilarityResult result, String errorMessage) {

    public static PairScore success(int pairIndex, String leftId, String rightId, SimilarityResult result) {
        return new PairScore(pairIndex, leftId, rightId, result, null);
    }

    public static PairScore failure(int pairIndex, String leftId, String rightId, String errorMessage) {
        return new PairScore(pairIndex, leftId, rightId, null, errorMessage);
    }

    public boolean isSuccess() {
        return result != null;
    }
}

package com.entity.linkage.scoring;

import java.util.List;

/**
 * Result of scoring a batch of pairs. Failed pairs stay in {@link #results()}
 * with an error message; they never abort the batch.
 */
public record BatchScoringResult(List<PairScore> results, int totalPairs, int successfulPairs,
                                 int failedPairs, double averageScore) {

    public BatchScoringResult {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static BatchScoringResult of(List<PairScore> results) {
        int failed = 0;
        double sum = 0.0;
        for (PairScore score : results) {
            if (score.isSuccess()) {
                sum += score.result().score();
            } else {
                failed++;
            }
        }
        int successful = results.size() - failed;
        double average = successful > 0 ? SimilarityResult.round(sum / successful) : 0.0;
        return new BatchScoringResult(results, results.size(), successful, failed, average);
    }

    public List<PairScore> successes() {
        return results.stream().filter(PairScore::isSuccess).toList();
    }

    public boolean hasFailures() {
        return failedPairs > 0;
    }
}

package com.entity.linkage.blocking;

import com.entity.linkage.core.model.CandidatePair;

import java.util.List;

/**
 * Generates candidate record pairs from a record collection so that only
 * plausible pairs reach the scorer.
 *
 * <p>A single call never returns the same unordered pair twice. Invalid
 * configuration is rejected when the strategy is built, never here.</p>
 */
public interface BlockingStrategy {

    /**
     * Name used to tag emitted pairs and statistics.
     */
    String getName();

    BlockingStrategyType getType();

    /**
     * Generates the candidate pairs, sorted by identifier pair.
     *
     * @return deduplicated candidate pairs (never null)
     */
    List<CandidatePair> generateCandidates();

    /**
     * Statistics of the most recent {@link #generateCandidates()} call.
     */
    BlockingStatistics getStatistics();
}

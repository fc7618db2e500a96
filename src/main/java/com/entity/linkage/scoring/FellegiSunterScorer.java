package com.entity.linkage.scoring;

import com.entity.linkage.core.model.CandidatePair;
import com.entity.linkage.core.model.MatchDecision;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Probabilistic record-pair scorer following the Fellegi-Sunter model.
 *
 * <p>Each configured field that is present on both records contributes
 * {@code importance * log2(m/u)} when its raw similarity reaches the field
 * threshold, and {@code importance * log2((1-m)/(1-u))} otherwise. The sum
 * is classified against the global thresholds:</p>
 * <ul>
 *   <li>score &gt;= upper: match</li>
 *   <li>score &lt;= lower: non-match</li>
 *   <li>otherwise: possible match, left for review</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public class FellegiSunterScorer {
    private static final Logger log = LoggerFactory.getLogger(FellegiSunterScorer.class);

    private final ScoringConfig config;
    private final MetricsService metricsService;

    public FellegiSunterScorer(ScoringConfig config) {
        this(config, NoOpMetricsService.INSTANCE);
    }

    public FellegiSunterScorer(ScoringConfig config, MetricsService metricsService) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    /**
     * Scores two records.
     *
     * @param left           first record
     * @param right          second record
     * @param includeDetails whether to keep per-field detail on the result
     * @return the aggregate result
     * @throws IllegalArgumentException if either record is null
     */
    public SimilarityResult score(Record left, Record right, boolean includeDetails) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Both records are required for scoring");
        }

        double total = 0.0;
        int compared = 0;
        List<FieldSimilarity> details = includeDetails ? new ArrayList<>() : List.of();

        for (FieldWeight weight : config.getFieldWeights()) {
            String a = left.getString(weight.field());
            String b = right.getString(weight.field());
            if (a == null || b == null || a.isBlank() || b.isBlank()) {
                continue;
            }
            double similarity = weight.method().algorithm().compute(a, b);
            boolean agreed = similarity >= weight.threshold();
            double contribution = agreed ? weight.agreementWeight() : weight.disagreementWeight();
            total += contribution;
            compared++;
            if (includeDetails) {
                details.add(new FieldSimilarity(weight.field(), similarity,
                        weight.method().algorithm().getName(), weight, agreed, contribution));
            }
        }

        MatchDecision decision = classify(total);
        SimilarityResult result = new SimilarityResult(total, decision, confidence(total), compared, details);
        metricsService.recordSimilarityScore(total);
        metricsService.recordDecision(decision);
        log.debug("scoring.pair left={} right={} score={} decision={} fieldsCompared={}",
                left.id(), right.id(), total, decision.label(), compared);
        return result;
    }

    /**
     * Scores two records, reporting any failure as a failed {@link PairScore}
     * instead of throwing.
     */
    public PairScore computeSimilarity(Record left, Record right, boolean includeDetails) {
        return scoreSafely(0, left, right, includeDetails);
    }

    /**
     * Scores a batch of loaded record pairs. A malformed pair is recorded as
     * failed and the batch continues.
     */
    public BatchScoringResult computeBatchSimilarity(List<RecordPair> pairs, boolean includeDetails) {
        List<PairScore> results = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            RecordPair pair = pairs.get(i);
            if (pair == null) {
                results.add(PairScore.failure(i, null, null, "Pair is null"));
                continue;
            }
            results.add(scoreSafely(i, pair.left(), pair.right(), includeDetails));
        }
        return finish(results);
    }

    /**
     * Loads the records of each candidate pair from the store and scores them.
     * Pairs whose records are missing are recorded as failed.
     */
    public BatchScoringResult computeBatchSimilarity(List<CandidatePair> pairs, RecordStore store,
                                                     boolean includeDetails) {
        Set<String> ids = new HashSet<>();
        for (CandidatePair pair : pairs) {
            ids.add(pair.leftId());
            ids.add(pair.rightId());
        }
        Map<String, Record> records = store.findByIds(ids).stream()
                .collect(Collectors.toMap(Record::id, Function.identity(), (a, b) -> a));

        List<PairScore> results = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            CandidatePair pair = pairs.get(i);
            Record left = records.get(pair.leftId());
            Record right = records.get(pair.rightId());
            if (left == null || right == null) {
                String missing = left == null ? pair.leftId() : pair.rightId();
                results.add(PairScore.failure(i, pair.leftId(), pair.rightId(), "Record not found: " + missing));
                continue;
            }
            results.add(scoreSafely(i, left, right, includeDetails));
        }
        return finish(results);
    }

    public ScoringConfig getConfig() {
        return config;
    }

    private PairScore scoreSafely(int index, Record left, Record right, boolean includeDetails) {
        String leftId = left != null ? left.id() : null;
        String rightId = right != null ? right.id() : null;
        try {
            return PairScore.success(index, leftId, rightId, score(left, right, includeDetails));
        } catch (RuntimeException e) {
            log.warn("scoring.failed pairIndex={} left={} right={} error={}", index, leftId, rightId, e.getMessage());
            return PairScore.failure(index, leftId, rightId, e.getMessage());
        }
    }

    private BatchScoringResult finish(List<PairScore> results) {
        BatchScoringResult batch = BatchScoringResult.of(results);
        if (batch.failedPairs() > 0) {
            metricsService.incrementScoringFailures(batch.failedPairs());
        }
        log.info("scoring.batch totalPairs={} successfulPairs={} failedPairs={} averageScore={}",
                batch.totalPairs(), batch.successfulPairs(), batch.failedPairs(), batch.averageScore());
        return batch;
    }

    private MatchDecision classify(double score) {
        if (score >= config.getUpperThreshold()) {
            return MatchDecision.MATCH;
        }
        if (score <= config.getLowerThreshold()) {
            return MatchDecision.NON_MATCH;
        }
        return MatchDecision.POSSIBLE_MATCH;
    }

    private double confidence(double score) {
        double range = config.getUpperThreshold() - config.getLowerThreshold();
        double normalized = (score - config.getLowerThreshold()) / range;
        return Math.max(0.0, Math.min(1.0, normalized));
    }
}

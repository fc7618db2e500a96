package com.entity.linkage.pipeline;

import com.entity.linkage.blocking.BlockingStatistics;
import com.entity.linkage.cluster.ClusteringResult;
import com.entity.linkage.core.model.MatchDecision;
import com.entity.linkage.edge.EdgeWriteResult;
import com.entity.linkage.golden.GoldenRecordRunResult;
import com.entity.linkage.scoring.BatchScoringResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one linkage run, stage by stage.
 */
public record PipelineResult(String runId,
                             BlockingStatistics blocking,
                             int candidatePairs,
                             BatchScoringResult scoring,
                             Map<MatchDecision, Integer> decisions,
                             EdgeWriteResult edges,
                             ClusteringResult clustering,
                             GoldenRecordRunResult goldenRecords,
                             long durationMillis) {

    public PipelineResult {
        EnumMap<MatchDecision, Integer> counts = new EnumMap<>(MatchDecision.class);
        for (MatchDecision decision : MatchDecision.values()) {
            counts.put(decision, decisions.getOrDefault(decision, 0));
        }
        decisions = Collections.unmodifiableMap(counts);
    }

    public int matches() {
        return decisions.get(MatchDecision.MATCH);
    }

    public int clusterCount() {
        return clustering.clusters().size();
    }
}

package com.entity.linkage.golden;

import com.entity.linkage.core.model.Cluster;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.edge.EdgeKeys;
import com.entity.linkage.logging.LogContext;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds golden records from clusters.
 *
 * <p>Golden records are keyed by their sorted member ids and upserted, and
 * resolved-to edges are inserted with ignore-on-conflict, so running twice
 * over the same clusters adds nothing.</p>
 */
public class GoldenRecordService {
    private static final Logger log = LoggerFactory.getLogger(GoldenRecordService.class);

    private final RecordStore recordStore;
    private final GoldenRecordStore goldenRecordStore;
    private final FieldMergePolicy mergePolicy;
    private final Clock clock;

    public GoldenRecordService(RecordStore recordStore, GoldenRecordStore goldenRecordStore) {
        this(recordStore, goldenRecordStore, new MostFrequentValuePolicy(), Clock.systemUTC());
    }

    public GoldenRecordService(RecordStore recordStore, GoldenRecordStore goldenRecordStore,
                               FieldMergePolicy mergePolicy, Clock clock) {
        if (recordStore == null || goldenRecordStore == null || mergePolicy == null) {
            throw new IllegalArgumentException("recordStore, goldenRecordStore and mergePolicy are required");
        }
        this.recordStore = recordStore;
        this.goldenRecordStore = goldenRecordStore;
        this.mergePolicy = mergePolicy;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Writes one golden record per cluster of at least {@code minClusterSize} members.
     *
     * @param runId          identifier of this run, stored on every write
     * @param clusters       the clusters to consolidate
     * @param minClusterSize smallest cluster consolidated
     * @param method         clustering method tag
     */
    public GoldenRecordRunResult run(String runId, List<Cluster> clusters, int minClusterSize, String method) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        try (LogContext ignored = LogContext.forRun(runId).with("stage", "golden")) {
            List<GoldenRecord> goldenRecords = new ArrayList<>();
            List<ResolvedEdge> resolvedEdges = new ArrayList<>();
            int skipped = 0;

            for (Cluster cluster : clusters) {
                if (cluster.size() < minClusterSize) {
                    skipped++;
                    continue;
                }
                List<Record> members = recordStore.findByIds(cluster.members());
                if (members.isEmpty()) {
                    log.warn("golden.cluster.noMembers cluster={} size={}", cluster.id(), cluster.size());
                    skipped++;
                    continue;
                }
                if (members.size() < cluster.size()) {
                    log.warn("golden.cluster.missingMembers cluster={} expected={} found={}",
                            cluster.id(), cluster.size(), members.size());
                }

                String goldenKey = EdgeKeys.goldenKey(cluster.members());
                FieldMergePolicy.MergedFields merged = mergePolicy.merge(members);
                goldenRecords.add(new GoldenRecord(goldenKey, cluster.members(), merged.values(),
                        merged.provenance(), runId, method, clock.instant()));
                for (String memberId : cluster.members()) {
                    resolvedEdges.add(new ResolvedEdge(EdgeKeys.resolvedEdgeKey(memberId, goldenKey),
                            memberId, goldenKey, runId));
                }
            }

            int created = goldenRecords.isEmpty() ? 0 : goldenRecordStore.upsertGoldenRecords(goldenRecords);
            int edges = resolvedEdges.isEmpty() ? 0 : goldenRecordStore.insertResolvedEdges(resolvedEdges, true);

            GoldenRecordRunResult result = new GoldenRecordRunResult(goldenRecords.size(), skipped,
                    goldenRecords.size(), created, edges);
            log.info("golden.completed clusters={} skipped={} upserted={} created={} resolvedEdges={}",
                    result.clustersProcessed(), skipped, result.goldenRecordsUpserted(), created, edges);
            return result;
        }
    }
}

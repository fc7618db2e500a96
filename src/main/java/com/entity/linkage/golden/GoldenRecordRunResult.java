package com.entity.linkage.golden;

/**
 * Counters of one golden-record run.
 *
 * @param clustersProcessed       clusters that produced a golden record
 * @param clustersSkipped         clusters below the minimum size or without loadable members
 * @param goldenRecordsUpserted   golden records written (created or replaced)
 * @param goldenRecordsCreated    golden records that did not exist before
 * @param resolvedEdgesInserted   resolved-to edges that did not exist before
 */
public record GoldenRecordRunResult(int clustersProcessed, int clustersSkipped, int goldenRecordsUpserted,
                                    int goldenRecordsCreated, int resolvedEdgesInserted) {
}

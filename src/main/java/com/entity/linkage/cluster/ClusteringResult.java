package com.entity.linkage.cluster;

import com.entity.linkage.core.model.Cluster;

import java.util.List;
import java.util.Optional;

/**
 * Clusters of one WCC pass in canonical order, with their statistics.
 *
 * @param clusters          clusters sorted by smallest member id
 * @param statistics        size figures
 * @param edgesProcessed    edges read
 * @param componentsDropped components below the minimum size
 */
public record ClusteringResult(List<Cluster> clusters, ClusterStatistics statistics,
                               int edgesProcessed, int componentsDropped) {

    public ClusteringResult {
        clusters = List.copyOf(clusters);
    }

    /**
     * Returns the cluster containing the record, if any.
     */
    public Optional<Cluster> findClusterByMember(String recordId) {
        return clusters.stream().filter(c -> c.contains(recordId)).findFirst();
    }
}

package com.entity.linkage.cluster;

import com.entity.linkage.core.model.Cluster;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Size figures of a clustering run.
 *
 * @param totalClusters          number of clusters kept
 * @param totalEntitiesClustered records inside kept clusters
 * @param minClusterSize         smallest kept cluster (0 when none)
 * @param avgClusterSize         mean size rounded to two decimals
 * @param maxClusterSize         largest kept cluster (0 when none)
 * @param sizeDistribution       cluster count per bucket: 2, 3, 4-10, 11-50, 51+
 */
public record ClusterStatistics(int totalClusters, int totalEntitiesClustered, int minClusterSize,
                                double avgClusterSize, int maxClusterSize,
                                Map<String, Integer> sizeDistribution) {

    public static final List<String> BUCKETS = List.of("2", "3", "4-10", "11-50", "51+");

    public ClusterStatistics {
        sizeDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(sizeDistribution));
    }

    public static ClusterStatistics of(List<Cluster> clusters) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        BUCKETS.forEach(bucket -> distribution.put(bucket, 0));
        if (clusters.isEmpty()) {
            return new ClusterStatistics(0, 0, 0, 0.0, 0, distribution);
        }

        int total = 0;
        int min = Integer.MAX_VALUE;
        int max = 0;
        for (Cluster cluster : clusters) {
            int size = cluster.size();
            total += size;
            min = Math.min(min, size);
            max = Math.max(max, size);
            distribution.merge(bucketOf(size), 1, Integer::sum);
        }
        double avg = BigDecimal.valueOf((double) total / clusters.size())
                .setScale(2, RoundingMode.HALF_UP).doubleValue();
        return new ClusterStatistics(clusters.size(), total, min, avg, max, distribution);
    }

    static String bucketOf(int size) {
        if (size <= 2) {
            return "2";
        }
        if (size == 3) {
            return "3";
        }
        if (size <= 10) {
            return "4-10";
        }
        if (size <= 50) {
            return "11-50";
        }
        return "51+";
    }
}

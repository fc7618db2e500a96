package com.entity.linkage.cluster;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.Cluster;
import com.entity.linkage.core.model.MatchEdge;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Weakly-connected-component clustering of match edges.
 *
 * <p>One union per edge, ignoring direction. Components with at least
 * {@code minClusterSize} members become clusters; members are sorted and
 * clusters are ordered by their smallest member, so the output depends only
 * on the edge set, not on its order. The pass is global and single-threaded:
 * run it after all edges of a run exist.</p>
 */
public class WccClusteringService {
    private static final Logger log = LoggerFactory.getLogger(WccClusteringService.class);

    public static final int DEFAULT_MIN_CLUSTER_SIZE = 2;

    private final int minClusterSize;
    private final MetricsService metricsService;

    public WccClusteringService() {
        this(DEFAULT_MIN_CLUSTER_SIZE, NoOpMetricsService.INSTANCE);
    }

    public WccClusteringService(int minClusterSize, MetricsService metricsService) {
        if (minClusterSize < 2) {
            throw new ConfigurationException("minClusterSize must be >= 2, got " + minClusterSize);
        }
        this.minClusterSize = minClusterSize;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    public ClusteringResult cluster(Collection<MatchEdge> edges) {
        DisjointSet components = new DisjointSet();
        for (MatchEdge edge : edges) {
            components.union(edge.fromId(), edge.toId());
        }

        Map<String, TreeSet<String>> byRoot = new HashMap<>();
        for (String id : components.elements()) {
            byRoot.computeIfAbsent(components.find(id), r -> new TreeSet<>()).add(id);
        }

        List<TreeSet<String>> kept = new ArrayList<>();
        int dropped = 0;
        for (TreeSet<String> members : byRoot.values()) {
            if (members.size() >= minClusterSize) {
                kept.add(members);
            } else {
                dropped++;
            }
        }
        kept.sort(Comparator.comparing((TreeSet<String> members) -> members.first()));

        List<Cluster> clusters = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            Cluster cluster = new Cluster(String.format("cluster_%06d", i), new ArrayList<>(kept.get(i)));
            clusters.add(cluster);
            metricsService.recordClusterSize(cluster.size());
        }

        ClusterStatistics statistics = ClusterStatistics.of(clusters);
        log.info("clustering.completed edges={} clusters={} entities={} dropped={} maxSize={}",
                edges.size(), statistics.totalClusters(), statistics.totalEntitiesClustered(),
                dropped, statistics.maxClusterSize());
        return new ClusteringResult(clusters, statistics, edges.size(), dropped);
    }

    /**
     * Checks that clusters do not overlap, respect the minimum size, and
     * keep both endpoints of every edge together.
     */
    public ClusterValidationReport validate(List<Cluster> clusters, Collection<MatchEdge> edges) {
        List<String> issues = new ArrayList<>();
        Map<String, String> owner = new HashMap<>();
        for (Cluster cluster : clusters) {
            if (cluster.size() < minClusterSize) {
                issues.add("Cluster " + cluster.id() + " has " + cluster.size()
                        + " members, below minimum " + minClusterSize);
            }
            for (String member : cluster.members()) {
                String previous = owner.putIfAbsent(member, cluster.id());
                if (previous != null) {
                    issues.add("Record " + member + " is in both " + previous + " and " + cluster.id());
                }
            }
        }
        for (MatchEdge edge : edges) {
            String from = owner.get(edge.fromId());
            String to = owner.get(edge.toId());
            if ((from != null || to != null) && (from == null || !from.equals(to))) {
                issues.add("Edge " + edge.fromId() + " -> " + edge.toId() + " crosses clusters");
            }
        }
        if (!issues.isEmpty()) {
            log.warn("clustering.validation.failed issues={}", issues.size());
        }
        return new ClusterValidationReport(issues);
    }

    public int getMinClusterSize() {
        return minClusterSize;
    }
}

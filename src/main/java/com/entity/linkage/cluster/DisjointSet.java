package com.entity.linkage.cluster;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Union-find over string identifiers with path compression and union by rank.
 * Not thread-safe; a clustering pass owns its instance.
 */
final class DisjointSet {

    private final Map<String, String> parent = new HashMap<>();
    private final Map<String, Integer> rank = new HashMap<>();

    void add(String id) {
        if (parent.putIfAbsent(id, id) == null) {
            rank.put(id, 0);
        }
    }

    String find(String id) {
        add(id);
        String root = id;
        while (!root.equals(parent.get(root))) {
            root = parent.get(root);
        }
        String current = id;
        while (!current.equals(root)) {
            String next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    void union(String a, String b) {
        String rootA = find(a);
        String rootB = find(b);
        if (rootA.equals(rootB)) {
            return;
        }
        int rankA = rank.get(rootA);
        int rankB = rank.get(rootB);
        if (rankA < rankB) {
            parent.put(rootA, rootB);
        } else if (rankA > rankB) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootB, rootA);
            rank.put(rootA, rankA + 1);
        }
    }

    Set<String> elements() {
        return parent.keySet();
    }
}

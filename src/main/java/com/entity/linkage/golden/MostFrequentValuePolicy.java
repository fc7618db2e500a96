package com.entity.linkage.golden;

import com.entity.linkage.core.model.Record;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Picks, per field, the value most members agree on.
 * Ties go to the longest string form, then to the lexicographically smallest.
 * Null, blank and non-scalar values (vectors, nested maps) are ignored, as are system fields.
 */
public class MostFrequentValuePolicy implements FieldMergePolicy {

    public static final Set<String> DEFAULT_SYSTEM_FIELDS = Set.of("id", "_id", "_key", "_rev");

    private final Set<String> systemFields;

    public MostFrequentValuePolicy() {
        this(DEFAULT_SYSTEM_FIELDS);
    }

    public MostFrequentValuePolicy(Set<String> systemFields) {
        this.systemFields = Set.copyOf(systemFields);
    }

    @Override
    public MergedFields merge(List<Record> members) {
        Set<String> fieldNames = new TreeSet<>();
        members.forEach(m -> fieldNames.addAll(m.fields().keySet()));

        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, List<String>> provenance = new LinkedHashMap<>();
        for (String field : fieldNames) {
            if (systemFields.contains(field) || field.startsWith("_")) {
                continue;
            }
            Map<String, Candidate> candidates = new LinkedHashMap<>();
            for (Record member : members) {
                Object value = member.get(field);
                if (!isScalar(value) || value.toString().isBlank()) {
                    continue;
                }
                candidates.computeIfAbsent(value.toString(), k -> new Candidate(value)).sources.add(member.id());
            }
            if (candidates.isEmpty()) {
                continue;
            }
            Candidate best = candidates.entrySet().stream()
                    .sorted(Comparator.<Map.Entry<String, Candidate>>comparingInt(e -> e.getValue().sources.size())
                            .reversed()
                            .thenComparing(e -> e.getKey().length(), Comparator.reverseOrder())
                            .thenComparing(Map.Entry::getKey))
                    .findFirst()
                    .map(Map.Entry::getValue)
                    .orElseThrow();
            values.put(field, best.value);
            provenance.put(field, List.copyOf(new TreeSet<>(best.sources)));
        }
        return new MergedFields(values, provenance);
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static final class Candidate {
        private final Object value;
        private final List<String> sources = new ArrayList<>();

        private Candidate(Object value) {
            this.value = value;
        }
    }
}

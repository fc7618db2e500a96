package com.entity.linkage.blocking;

import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.store.RecordStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sorts records by a composite key and pairs every two records that fall
 * within the same window of consecutive positions.
 */
public class SortedNeighborhoodStrategy extends AbstractBlockingStrategy {

    private final SortedNeighborhoodParams params;

    public SortedNeighborhoodStrategy(RecordStore store, SortedNeighborhoodParams params,
                                      int pageSize, MetricsService metricsService) {
        super(store, params.filters(), pageSize, metricsService);
        this.params = params;
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.SORTED_NEIGHBORHOOD;
    }

    @Override
    protected void collect(Run run) {
        List<SortEntry> entries = new ArrayList<>();
        forEachFilteredRecord(run, record -> {
            StringBuilder key = new StringBuilder();
            boolean any = false;
            for (String field : params.sortFields()) {
                String value = record.getString(field);
                if (value != null && !value.isBlank()) {
                    any = true;
                    key.append(value.trim().toUpperCase(Locale.ROOT));
                }
                key.append('\u0000');
            }
            if (any) {
                entries.add(new SortEntry(key.toString(), record.id()));
            }
        });
        entries.sort(Comparator.comparing(SortEntry::key).thenComparing(SortEntry::id));

        int window = params.windowSize();
        int n = entries.size();
        for (int i = 0; i < n - 1; i++) {
            int end = Math.min(n, i + window);
            for (int j = i + 1; j < end; j++) {
                run.emit(entries.get(i).id(), entries.get(j).id(), "window:" + i, Map.of());
            }
        }
        // one window per start position that fits, or a single short window
        run.addBlocks(n < 2 ? 0 : Math.max(1, n - window + 1));
        run.detail("window_size", window);
        run.detail("sorted_records", entries.size());
    }

    private record SortEntry(String key, String id) {
    }
}

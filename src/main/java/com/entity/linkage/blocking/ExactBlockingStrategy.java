package com.entity.linkage.blocking;

import com.entity.linkage.core.model.Record;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.store.RecordStore;

import java.util.Locale;
import java.util.Set;

/**
 * Groups records whose blocking fields are all equal after trimming and case folding.
 * A record missing any key field is not blocked.
 */
public class ExactBlockingStrategy extends KeyBasedBlockingStrategy {

    private final ExactBlockingParams params;

    public ExactBlockingStrategy(RecordStore store, ExactBlockingParams params,
                                 int pageSize, MetricsService metricsService) {
        super(store, params.filters(), pageSize, params.minBlockSize(), params.maxBlockSize(), metricsService);
        this.params = params;
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.EXACT;
    }

    @Override
    public Set<String> generateKeys(Record record) {
        StringBuilder key = new StringBuilder();
        for (String field : params.fields()) {
            String value = record.getString(field);
            if (value == null || value.isBlank()) {
                return Set.of();
            }
            appendPart(key, value.trim().toUpperCase(Locale.ROOT));
        }
        for (ComputedField computed : params.computedFields()) {
            String value = computed.apply(record);
            if (value == null) {
                return Set.of();
            }
            appendPart(key, value);
        }
        return Set.of(key.toString());
    }

    private static void appendPart(StringBuilder key, String part) {
        if (key.length() > 0) {
            key.append('|');
        }
        key.append(keyPart(part));
    }
}

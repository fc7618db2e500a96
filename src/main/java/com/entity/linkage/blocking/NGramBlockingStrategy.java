package com.entity.linkage.blocking;

import com.entity.linkage.core.model.Record;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.similarity.NGramSimilarity;
import com.entity.linkage.store.RecordStore;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Blocks records on the character n-grams (or the prefix) of a normalized field.
 * Normalization lower-cases the value and strips everything except letters and digits.
 */
public class NGramBlockingStrategy extends KeyBasedBlockingStrategy {

    private final NGramBlockingParams params;

    public NGramBlockingStrategy(RecordStore store, NGramBlockingParams params,
                                 int pageSize, MetricsService metricsService) {
        super(store, params.filters(), pageSize, params.minBlockSize(), params.maxBlockSize(), metricsService);
        this.params = params;
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.NGRAM;
    }

    @Override
    public Set<String> generateKeys(Record record) {
        String normalized = normalize(record.getString(params.field()));
        if (normalized.isEmpty()) {
            return Set.of();
        }
        if (params.mode() == NGramBlockingParams.Mode.PREFIX) {
            return Set.of("pfx:" + normalized.substring(0, Math.min(params.size(), normalized.length())));
        }
        Set<String> keys = new TreeSet<>();
        for (String gram : NGramSimilarity.grams(normalized, params.size())) {
            keys.add("ng:" + gram);
        }
        return keys;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{Nd}]", "");
    }
}

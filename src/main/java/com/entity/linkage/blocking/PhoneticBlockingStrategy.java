package com.entity.linkage.blocking;

import com.entity.linkage.core.model.Record;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.similarity.SoundexEncoder;
import com.entity.linkage.store.RecordStore;

import java.util.Set;

/**
 * Blocks records on the Soundex codes of their name fields.
 */
public class PhoneticBlockingStrategy extends KeyBasedBlockingStrategy {

    private final PhoneticBlockingParams params;

    public PhoneticBlockingStrategy(RecordStore store, PhoneticBlockingParams params,
                                    int pageSize, MetricsService metricsService) {
        super(store, params.filters(), pageSize, params.minBlockSize(), params.maxBlockSize(), metricsService);
        this.params = params;
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.PHONETIC;
    }

    @Override
    public Set<String> generateKeys(Record record) {
        StringBuilder key = new StringBuilder();
        for (String field : params.fields()) {
            String code = SoundexEncoder.encode(record.getString(field));
            if (SoundexEncoder.EMPTY_CODE.equals(code)) {
                return Set.of();
            }
            if (key.length() > 0) {
                key.append('|');
            }
            key.append(code);
        }
        return Set.of(key.toString());
    }
}

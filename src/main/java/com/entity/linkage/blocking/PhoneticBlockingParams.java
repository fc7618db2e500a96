package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * Phonetic blocking: the Soundex codes of the name fields form the block key.
 */
public record PhoneticBlockingParams(List<String> fields, int minBlockSize, int maxBlockSize,
                                     List<RecordFilter> filters) implements BlockingParams {

    public PhoneticBlockingParams {
        fields = fields != null ? List.copyOf(fields) : List.of();
        if (fields.isEmpty()) {
            throw new ConfigurationException("Phonetic blocking requires at least one name field");
        }
        ExactBlockingParams.validateFields(fields);
        BlockSizes.validate(minBlockSize, maxBlockSize);
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    public static PhoneticBlockingParams of(String... fields) {
        return new PhoneticBlockingParams(List.of(fields), ExactBlockingParams.DEFAULT_MIN_BLOCK_SIZE,
                ExactBlockingParams.DEFAULT_MAX_BLOCK_SIZE, List.of());
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.PHONETIC;
    }
}

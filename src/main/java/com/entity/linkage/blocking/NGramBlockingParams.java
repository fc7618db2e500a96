package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * N-gram blocking: each character n-gram (or the k-character prefix) of a
 * normalized field is a block key; records sharing any key collide.
 */
public record NGramBlockingParams(String field, Mode mode, int size, int minBlockSize, int maxBlockSize,
                                  List<RecordFilter> filters) implements BlockingParams {

    public enum Mode { NGRAMS, PREFIX }

    public static final int DEFAULT_NGRAM_SIZE = 3;

    public NGramBlockingParams {
        if (field == null) {
            throw new ConfigurationException("N-gram blocking requires a blocking field");
        }
        ExactBlockingParams.validateFields(List.of(field));
        if (mode == null) {
            mode = Mode.NGRAMS;
        }
        if (size < 1) {
            throw new ConfigurationException("n-gram size must be >= 1, got " + size);
        }
        BlockSizes.validate(minBlockSize, maxBlockSize);
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    public static NGramBlockingParams ngrams(String field, int n) {
        return new NGramBlockingParams(field, Mode.NGRAMS, n, ExactBlockingParams.DEFAULT_MIN_BLOCK_SIZE,
                ExactBlockingParams.DEFAULT_MAX_BLOCK_SIZE, List.of());
    }

    public static NGramBlockingParams prefix(String field, int length) {
        return new NGramBlockingParams(field, Mode.PREFIX, length, ExactBlockingParams.DEFAULT_MIN_BLOCK_SIZE,
                ExactBlockingParams.DEFAULT_MAX_BLOCK_SIZE, List.of());
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.NGRAM;
    }
}

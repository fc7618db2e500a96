package com.entity.linkage.blocking;

import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.exception.ValidationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * Exact blocking: records whose key fields (and computed fields) are all equal share a block.
 *
 * @param fields         fields compared for equality
 * @param computedFields derived values added to the key
 * @param minBlockSize   blocks smaller than this emit nothing
 * @param maxBlockSize   blocks larger than this are skipped entirely
 * @param filters        record pre-filters
 */
public record ExactBlockingParams(List<String> fields, List<ComputedField> computedFields,
                                  int minBlockSize, int maxBlockSize,
                                  List<RecordFilter> filters) implements BlockingParams {

    public static final int DEFAULT_MIN_BLOCK_SIZE = 2;
    public static final int DEFAULT_MAX_BLOCK_SIZE = 100;

    public ExactBlockingParams {
        fields = fields != null ? List.copyOf(fields) : List.of();
        computedFields = computedFields != null ? List.copyOf(computedFields) : List.of();
        filters = filters != null ? List.copyOf(filters) : List.of();
        if (fields.isEmpty() && computedFields.isEmpty()) {
            throw new ConfigurationException("Exact blocking requires at least one blocking field");
        }
        validateFields(fields);
        BlockSizes.validate(minBlockSize, maxBlockSize);
    }

    public static ExactBlockingParams of(String... fields) {
        return new ExactBlockingParams(List.of(fields), List.of(), DEFAULT_MIN_BLOCK_SIZE,
                DEFAULT_MAX_BLOCK_SIZE, List.of());
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.EXACT;
    }

    static void validateFields(List<String> fields) {
        for (String field : fields) {
            try {
                InputSanitizer.validateFieldName(field);
            } catch (ValidationException e) {
                throw new ConfigurationException("Invalid blocking field: " + e.getMessage(), e);
            }
        }
    }
}

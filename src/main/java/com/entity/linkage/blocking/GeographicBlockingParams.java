package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Geographic blocking: records in the same state, city, city and state, or ZIP area share a block.
 *
 * @param level           which geographic attribute forms the block
 * @param stateField      field holding the state or province, required for STATE and CITY_STATE
 * @param cityField       field holding the city, required for CITY and CITY_STATE
 * @param zipField        field holding the postal code, required for ZIP_RANGE and ZIP_PREFIX
 * @param zipRanges       inclusive ranges a postal code must fall in, required for ZIP_RANGE
 * @param zipPrefixLength leading characters of the postal code used by ZIP_PREFIX
 * @param minBlockSize    blocks smaller than this emit nothing
 * @param maxBlockSize    blocks larger than this are skipped entirely
 * @param filters         record pre-filters
 */
public record GeographicBlockingParams(Level level, String stateField, String cityField, String zipField,
                                       List<ZipRange> zipRanges, int zipPrefixLength,
                                       int minBlockSize, int maxBlockSize,
                                       List<RecordFilter> filters) implements BlockingParams {

    public static final int DEFAULT_MAX_BLOCK_SIZE = 1000;
    public static final int DEFAULT_ZIP_PREFIX_LENGTH = 3;

    public enum Level {
        STATE, CITY, CITY_STATE, ZIP_RANGE, ZIP_PREFIX
    }

    /**
     * Inclusive postal code range compared as strings. A code is compared on as
     * many leading characters as each bound has, so {@code 570..577} covers
     * {@code 57001} through {@code 57799}.
     */
    public record ZipRange(String min, String max) {

        public ZipRange {
            if (min == null || min.isBlank() || max == null || max.isBlank()) {
                throw new ConfigurationException("ZIP range bounds must not be blank");
            }
            min = min.trim();
            max = max.trim();
        }

        public boolean contains(String zip) {
            return prefix(zip, min.length()).compareTo(min) >= 0
                    && prefix(zip, max.length()).compareTo(max) <= 0;
        }

        private static String prefix(String zip, int length) {
            return zip.length() <= length ? zip : zip.substring(0, length);
        }
    }

    public GeographicBlockingParams {
        if (level == null) {
            throw new ConfigurationException("Geographic blocking requires a level");
        }
        zipRanges = zipRanges != null ? List.copyOf(zipRanges) : List.of();
        filters = filters != null ? List.copyOf(filters) : List.of();
        List<String> required = new ArrayList<>();
        switch (level) {
            case STATE -> required.add(require(stateField, "stateField", level));
            case CITY -> required.add(require(cityField, "cityField", level));
            case CITY_STATE -> {
                required.add(require(cityField, "cityField", level));
                required.add(require(stateField, "stateField", level));
            }
            case ZIP_RANGE, ZIP_PREFIX -> required.add(require(zipField, "zipField", level));
        }
        ExactBlockingParams.validateFields(required);
        if (level == Level.ZIP_RANGE && zipRanges.isEmpty()) {
            throw new ConfigurationException("ZIP_RANGE blocking requires at least one ZIP range");
        }
        if (level == Level.ZIP_PREFIX && zipPrefixLength < 1) {
            throw new ConfigurationException("zipPrefixLength must be >= 1, got " + zipPrefixLength);
        }
        BlockSizes.validate(minBlockSize, maxBlockSize);
    }

    private static String require(String field, String name, Level level) {
        if (field == null || field.isBlank()) {
            throw new ConfigurationException(level + " blocking requires " + name);
        }
        return field;
    }

    public static GeographicBlockingParams byState(String stateField) {
        return of(Level.STATE, stateField, null, null, List.of());
    }

    public static GeographicBlockingParams byCity(String cityField) {
        return of(Level.CITY, null, cityField, null, List.of());
    }

    public static GeographicBlockingParams byCityAndState(String cityField, String stateField) {
        return of(Level.CITY_STATE, stateField, cityField, null, List.of());
    }

    public static GeographicBlockingParams byZipRanges(String zipField, ZipRange... ranges) {
        return of(Level.ZIP_RANGE, null, null, zipField, Arrays.asList(ranges));
    }

    public static GeographicBlockingParams byZipPrefix(String zipField, int prefixLength) {
        return new GeographicBlockingParams(Level.ZIP_PREFIX, null, null, zipField, List.of(), prefixLength,
                ExactBlockingParams.DEFAULT_MIN_BLOCK_SIZE, DEFAULT_MAX_BLOCK_SIZE, List.of());
    }

    private static GeographicBlockingParams of(Level level, String stateField, String cityField,
                                               String zipField, List<ZipRange> ranges) {
        return new GeographicBlockingParams(level, stateField, cityField, zipField, ranges,
                DEFAULT_ZIP_PREFIX_LENGTH, ExactBlockingParams.DEFAULT_MIN_BLOCK_SIZE, DEFAULT_MAX_BLOCK_SIZE,
                List.of());
    }

    public GeographicBlockingParams withFilters(List<RecordFilter> newFilters) {
        return new GeographicBlockingParams(level, stateField, cityField, zipField, zipRanges, zipPrefixLength,
                minBlockSize, maxBlockSize, newFilters);
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.GEOGRAPHIC;
    }
}

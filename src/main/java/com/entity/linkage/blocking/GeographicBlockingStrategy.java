package com.entity.linkage.blocking;

import com.entity.linkage.core.model.Record;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.store.RecordStore;

import java.util.Locale;
import java.util.Set;

/**
 * Blocks records by location. State and city values are compared trimmed and
 * case-folded; postal codes are compared as trimmed strings. With ZIP ranges,
 * records whose code falls outside every range are not blocked.
 */
public class GeographicBlockingStrategy extends KeyBasedBlockingStrategy {

    private final GeographicBlockingParams params;

    public GeographicBlockingStrategy(RecordStore store, GeographicBlockingParams params,
                                      int pageSize, MetricsService metricsService) {
        super(store, params.filters(), pageSize, params.minBlockSize(), params.maxBlockSize(), metricsService);
        this.params = params;
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.GEOGRAPHIC;
    }

    @Override
    protected void collect(Run run) {
        super.collect(run);
        run.detail("blocking_type", params.level().name().toLowerCase(Locale.ROOT));
    }

    @Override
    public Set<String> generateKeys(Record record) {
        return switch (params.level()) {
            case STATE -> key("state:", place(record, params.stateField()));
            case CITY -> key("city:", place(record, params.cityField()));
            case CITY_STATE -> {
                String city = place(record, params.cityField());
                String state = place(record, params.stateField());
                yield city == null || state == null ? Set.of() : key("city_state:", city + "|" + state);
            }
            case ZIP_RANGE -> {
                String zip = zip(record);
                yield zip != null && params.zipRanges().stream().anyMatch(range -> range.contains(zip))
                        ? key("zip:", keyPart(zip))
                        : Set.of();
            }
            case ZIP_PREFIX -> {
                String zip = zip(record);
                yield zip == null
                        ? Set.of()
                        : key("zip_prefix:", keyPart(zip.substring(0, Math.min(params.zipPrefixLength(), zip.length()))));
            }
        };
    }

    private static Set<String> key(String prefix, String value) {
        return value == null ? Set.of() : Set.of(prefix + value);
    }

    private static String place(Record record, String field) {
        String value = record.getString(field);
        if (value == null || value.isBlank()) {
            return null;
        }
        return keyPart(value.trim().toUpperCase(Locale.ROOT));
    }

    private String zip(Record record) {
        String value = record.getString(params.zipField());
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}

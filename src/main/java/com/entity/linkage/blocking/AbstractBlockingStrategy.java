package com.entity.linkage.blocking;

import com.entity.linkage.core.model.CandidatePair;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.logging.LogContext;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Base class handling pair canonicalization, deduplication, timing,
 * statistics and logging. Subclasses only decide which pairs to emit.
 */
public abstract class AbstractBlockingStrategy implements BlockingStrategy {
    private static final Logger log = LoggerFactory.getLogger(AbstractBlockingStrategy.class);

    protected final RecordStore store;
    protected final MetricsService metricsService;
    private final List<RecordFilter> filters;
    protected final int pageSize;
    private volatile BlockingStatistics lastStatistics;

    protected AbstractBlockingStrategy(RecordStore store, List<RecordFilter> filters,
                                       int pageSize, MetricsService metricsService) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
        this.store = store;
        this.filters = filters != null ? List.copyOf(filters) : List.of();
        this.pageSize = pageSize;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
        this.lastStatistics = BlockingStatistics.notRun(getName());
    }

    @Override
    public String getName() {
        return getType().label();
    }

    @Override
    public final List<CandidatePair> generateCandidates() {
        try (LogContext ignored = LogContext.forBlocking(getName())) {
            Instant start = Instant.now();
            Run run = new Run();
            collect(run);

            List<CandidatePair> pairs = new ArrayList<>(run.pairs.values());
            pairs.sort(Comparator.comparing(CandidatePair::leftId).thenComparing(CandidatePair::rightId));

            Duration elapsed = Duration.between(start, Instant.now());
            lastStatistics = new BlockingStatistics(getName(), run.recordsScanned, run.blocksFormed,
                    pairs.size(), run.skippedBlocks, elapsed.toMillis(), Instant.now(), run.details);

            metricsService.recordBlocking(getName(), pairs.size(), elapsed);
            if (run.skippedBlocks > 0) {
                metricsService.incrementSkippedBlocks(getName(), run.skippedBlocks);
            }
            log.info("blocking.completed strategy={} records={} blocks={} pairs={} skippedBlocks={} durationMs={}",
                    getName(), run.recordsScanned, run.blocksFormed, pairs.size(), run.skippedBlocks,
                    elapsed.toMillis());
            return pairs;
        }
    }

    @Override
    public BlockingStatistics getStatistics() {
        return lastStatistics;
    }

    /**
     * Emits the candidate pairs of this strategy into the run.
     */
    protected abstract void collect(Run run);

    /**
     * Visits every record that passes the configured filters, one page at a time.
     */
    protected void forEachFilteredRecord(Run run, Consumer<Record> consumer) {
        store.forEachRecord(pageSize, record -> {
            if (RecordFilter.all(filters, record)) {
                run.recordsScanned++;
                consumer.accept(record);
            }
        });
    }

    /**
     * Emits all pairs of a block, or skips it when its size is out of bounds.
     * Oversized blocks are skipped whole rather than truncated.
     */
    protected void emitBlock(Run run, String blockKey, List<String> ids, int minBlockSize, int maxBlockSize) {
        if (ids.size() < minBlockSize) {
            return;
        }
        if (ids.size() > maxBlockSize) {
            run.skippedBlocks++;
            log.debug("blocking.block.skipped strategy={} key={} size={} maxBlockSize={}",
                    getName(), blockKey, ids.size(), maxBlockSize);
            return;
        }
        run.blocksFormed++;
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                run.emit(ids.get(i), ids.get(j), blockKey, Map.of());
            }
        }
    }

    /**
     * Escapes the {@code |} separator so that joined key parts stay distinct:
     * {@code "a|b" + "c"} and {@code "a" + "b|c"} give different keys.
     */
    protected static String keyPart(String value) {
        return value.replace("\\", "\\\\").replace("|", "\\|");
    }

    /**
     * Mutable state of one {@link #generateCandidates()} call.
     */
    protected final class Run {
        private final Map<List<String>, CandidatePair> pairs = new LinkedHashMap<>();
        private final Map<String, Object> details = new LinkedHashMap<>();
        private int recordsScanned;
        private int blocksFormed;
        private int skippedBlocks;

        /**
         * Emits a pair; the first emission of an unordered pair wins.
         */
        public void emit(String a, String b, String blockKey, Map<String, Object> metadata) {
            if (a.equals(b)) {
                return;
            }
            CandidatePair pair = new CandidatePair(a, b, getName(), blockKey, metadata);
            pairs.putIfAbsent(pair.ids(), pair);
        }

        public void emit(CandidatePair pair) {
            pairs.putIfAbsent(pair.ids(), pair);
        }

        public void addBlocks(int count) {
            blocksFormed += count;
        }

        public void addSkippedBlocks(int count) {
            skippedBlocks += count;
        }

        public void addRecordsScanned(int count) {
            recordsScanned += count;
        }

        public int recordsScanned() {
            return recordsScanned;
        }

        public void detail(String key, Object value) {
            details.put(key, value);
        }
    }
}

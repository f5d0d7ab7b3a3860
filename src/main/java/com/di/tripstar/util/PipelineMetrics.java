package com.di.tripstar.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for pipeline runs: row counts per data-quality outcome,
 * table loads and per-stage durations.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    // Row metrics
    private final Counter rowsExtractedCounter;
    private final Counter rowsRejectedCounter;
    private final Counter rowsOrphanedCounter;
    private final Counter duplicatesRemovedCounter;
    private final Counter duplicateKeyCounter;

    // Load metrics
    private final Counter tablesLoadedCounter;
    private final Counter tablesFailedCounter;
    private final DistributionSummary rowsLoadedDistribution;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.rowsExtractedCounter = Counter.builder("tripstar.rows.extracted")
                .description("Valid trip rows read from the raw source")
                .register(meterRegistry);

        this.rowsRejectedCounter = Counter.builder("tripstar.rows.rejected")
                .description("Malformed raw rows skipped during extraction")
                .register(meterRegistry);

        this.rowsOrphanedCounter = Counter.builder("tripstar.rows.orphaned")
                .description("Trips dropped because a dimension lookup failed")
                .register(meterRegistry);

        this.duplicatesRemovedCounter = Counter.builder("tripstar.rows.duplicates.removed")
                .description("Fully duplicated trips collapsed in the fact table")
                .register(meterRegistry);

        this.duplicateKeyCounter = Counter.builder("tripstar.dimension.duplicate.keys")
                .description("Natural keys seen with conflicting descriptive values")
                .register(meterRegistry);

        this.tablesLoadedCounter = Counter.builder("tripstar.tables.loaded")
                .description("Tables loaded into the warehouse")
                .tag("status", "success")
                .register(meterRegistry);

        this.tablesFailedCounter = Counter.builder("tripstar.tables.loaded")
                .description("Table loads that failed")
                .tag("status", "error")
                .register(meterRegistry);

        this.rowsLoadedDistribution = DistributionSummary.builder("tripstar.table.rows")
                .description("Rows written per table load")
                .register(meterRegistry);
    }

    public void recordExtraction(long valid, long rejected) {
        rowsExtractedCounter.increment(valid);
        rowsRejectedCounter.increment(rejected);
    }

    public void recordOrphans(long orphans) {
        rowsOrphanedCounter.increment(orphans);
    }

    public void recordDuplicatesRemoved(long duplicates) {
        duplicatesRemovedCounter.increment(duplicates);
    }

    public void recordDuplicateKeys(long conflicts) {
        duplicateKeyCounter.increment(conflicts);
    }

    public void recordTableLoaded(long rows) {
        tablesLoadedCounter.increment();
        rowsLoadedDistribution.record(rows);
    }

    public void recordTableFailed() {
        tablesFailedCounter.increment();
    }

    public void recordStageDuration(String stage, long durationMs) {
        Timer.builder("tripstar.stage.duration")
                .description("Time spent in each pipeline stage")
                .tag("stage", stage)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordRun(String status) {
        Counter.builder("tripstar.runs.total")
                .description("Pipeline runs by terminal status")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
        log.debug("[METRICS] run recorded with status={}", status);
    }
}

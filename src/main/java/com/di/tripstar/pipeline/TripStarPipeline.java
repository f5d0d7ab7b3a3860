package com.di.tripstar.pipeline;

import com.di.tripstar.analytics.AnalyticsJoin;
import com.di.tripstar.analytics.AnalyticsViewBuilder;
import com.di.tripstar.aspect.ErrorCategory;
import com.di.tripstar.config.TripStarProperties;
import com.di.tripstar.extract.RawTripExtractor;
import com.di.tripstar.extract.RawTripTable;
import com.di.tripstar.pipeline.dto.PipelineRunRequest;
import com.di.tripstar.pipeline.dto.PipelineRunResponse;
import com.di.tripstar.transform.StarSchema;
import com.di.tripstar.transform.WarehouseTables;
import com.di.tripstar.transform.dimension.DimensionBuilder;
import com.di.tripstar.transform.dimension.TripDimensions;
import com.di.tripstar.transform.fact.FactBuilder;
import com.di.tripstar.transform.fact.FactTable;
import com.di.tripstar.util.PipelineMetrics;
import com.di.tripstar.util.TransactionEventLogger;
import com.di.tripstar.warehouse.TableLoadResult;
import com.di.tripstar.warehouse.ValidationResult;
import com.di.tripstar.warehouse.WarehouseLoader;
import com.di.tripstar.warehouse.WarehouseTable;
import com.di.tripstar.warehouse.WarehouseTarget;
import com.di.tripstar.warehouse.WarehouseTargetResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the trip ETL end to end as a plain sequence of calls:
 *
 * <ol>
 *   <li>EXTRACT           raw CSV into a {@link RawTripTable}</li>
 *   <li>BUILD_DIMENSIONS  the seven dimension tables</li>
 *   <li>BUILD_FACTS       {@code fact_table}</li>
 *   <li>LOAD              every table into BigQuery (full refresh)</li>
 *   <li>ANALYTICS         {@code tbl_analytics} rebuilt and reconciled</li>
 * </ol>
 *
 * <p>A failing stage ends the run as FAILED. LOAD attempts every table before
 * failing, so the run record names each table that did not load; there is no
 * rollback of tables that did. A dry run stops after BUILD_FACTS.
 *
 * <p>One run at a time per process: a second caller gets
 * {@link ConcurrentRunException} until the active run finishes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripStarPipeline {

    private final RawTripExtractor        extractor;
    private final DimensionBuilder        dimensionBuilder;
    private final FactBuilder             factBuilder;
    private final WarehouseLoader         warehouseLoader;
    private final AnalyticsViewBuilder    analyticsViewBuilder;
    private final WarehouseTargetResolver targetResolver;
    private final PipelineRunStore        runStore;
    private final PipelineMetrics         metrics;
    private final TransactionEventLogger  eventLogger;
    private final TripStarProperties      properties;

    private final AtomicReference<String> activeRun = new AtomicReference<>();

    public PipelineRunResponse run(PipelineRunRequest request) {
        String runId = "run-" + UUID.randomUUID();
        if (!activeRun.compareAndSet(null, runId)) {
            throw new ConcurrentRunException(activeRun.get());
        }

        PipelineRunRequest req = request != null ? request : new PipelineRunRequest();
        MDC.put("jobId", runId);
        try {
            return execute(runId, req);
        } finally {
            MDC.remove("jobId");
            activeRun.set(null);
        }
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    private PipelineRunResponse execute(String runId, PipelineRunRequest req) {
        String  sourceUri = req.getSourceUri() != null && !req.getSourceUri().isBlank()
                ? req.getSourceUri()
                : properties.getSource().getUri();
        boolean dryRun    = req.getDryRun() != null ? req.getDryRun() : properties.getPipeline().isDryRun();

        PipelineRun run = PipelineRun.builder()
                .runId(runId)
                .status(RunStatus.RUNNING)
                .dryRun(dryRun)
                .sourceUri(sourceUri)
                .dataset(req.getDataset())
                .startedAt(Instant.now())
                .build();
        runStore.save(run);

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("sourceUri", String.valueOf(sourceUri));
        ctx.put("dryRun", dryRun);
        eventLogger.logEvent("PIPELINE_RUN_STARTED", ctx, runId, "pipeline_run");
        log.info("[PIPELINE] run {} started: source={} dryRun={}", runId, sourceUri, dryRun);

        try {
            RawTripTable raw = stage(run, PipelineStage.EXTRACT, () -> extractor.extract(sourceUri));
            run.setRawRows(raw.size());
            run.setRejectedRows(raw.getRejected().size());
            metrics.recordExtraction(raw.size(), raw.getRejected().size());

            TripDimensions dimensions = stage(run, PipelineStage.BUILD_DIMENSIONS, () -> dimensionBuilder.buildAll(raw));
            run.setDuplicateKeyConflicts(dimensions.totalConflicts());
            metrics.recordDuplicateKeys(dimensions.totalConflicts());

            FactTable facts = stage(run, PipelineStage.BUILD_FACTS, () -> factBuilder.build(raw, dimensions));
            run.setFactRows(facts.size());
            run.setDuplicateRows(facts.getDuplicatesRemoved());
            run.setOrphanRows(facts.getOrphans().size());
            metrics.recordDuplicatesRemoved(facts.getDuplicatesRemoved());
            metrics.recordOrphans(facts.getOrphans().size());

            StarSchema schema = new StarSchema(dimensions, facts);
            long expectedAnalyticsRows = AnalyticsJoin.denormalize(schema).size();
            if (expectedAnalyticsRows != facts.size()) {
                log.warn("[PIPELINE] in-process analytics join kept {} of {} fact row(s)",
                         expectedAnalyticsRows, facts.size());
            }
            run.setAnalyticsRows(expectedAnalyticsRows);

            if (dryRun) {
                log.info("[PIPELINE] dry run: skipping LOAD and ANALYTICS");
            } else {
                WarehouseTarget target = stage(run, PipelineStage.LOAD, () -> load(run, schema));
                stage(run, PipelineStage.ANALYTICS, () -> buildAnalytics(target, expectedAnalyticsRows));
            }

            return finish(run, RunStatus.SUCCEEDED, String.format(
                    "Run completed: %d fact row(s), %d rejected, %d duplicate(s) removed, %d orphan(s)",
                    run.getFactRows(), run.getRejectedRows(), run.getDuplicateRows(), run.getOrphanRows()));

        } catch (PipelineStageException e) {
            run.setFailedStage(e.getStage());
            run.setErrorCategory(e.getCategory().name());
            run.setErrorMessage(e.getMessage());
            log.error("[PIPELINE] run {} failed at {} [{}]: {}", runId, e.getStage(), e.getCategory(), e.getMessage(), e);
            return finish(run, RunStatus.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            // failures between stages are charged to the stage that last ran
            ErrorCategory category = ErrorCategory.categorize(e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            run.setFailedStage(run.getCurrentStage());
            run.setErrorCategory(category.name());
            run.setErrorMessage(message);
            log.error("[PIPELINE] run {} failed after {} [{}]: {}", runId, run.getCurrentStage(), category, message, e);
            return finish(run, RunStatus.FAILED, message);
        }
    }

    private <T> T stage(PipelineRun run, PipelineStage stage, Supplier<T> body) {
        run.setCurrentStage(stage);
        long startMs = System.currentTimeMillis();
        log.info("[PIPELINE] >>> {}", stage);
        try {
            runStore.save(run);
            T result = body.get();
            long durationMs = System.currentTimeMillis() - startMs;
            metrics.recordStageDuration(stage.name(), durationMs);
            log.info("[PIPELINE] <<< {} in {} ms", stage, durationMs);
            return result;
        } catch (PipelineStageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipelineStageException(stage, ErrorCategory.categorize(e),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }

    private WarehouseTarget load(PipelineRun run, StarSchema schema) {
        WarehouseTarget target = targetResolver.resolve(run.getDataset());
        run.setProject(target.getProject());
        run.setDataset(target.getDataset());

        List<WarehouseTable> tables = WarehouseTables.of(schema, properties.getWarehouse().isPartitionDatetimeDim());
        Map<String, Long> loaded = new LinkedHashMap<>();
        List<String>      failed = new ArrayList<>();
        RuntimeException  firstFailure = null;

        for (WarehouseTable table : tables) {
            try {
                TableLoadResult result = warehouseLoader.load(target, table);
                loaded.put(table.getName(), result.getLoadedRows());
                metrics.recordTableLoaded(result.getLoadedRows());
            } catch (RuntimeException e) {
                log.error("[PIPELINE] {} {}: {}", ErrorCategory.categorize(e), table.getName(), e.getMessage());
                failed.add(table.getName());
                metrics.recordTableFailed();
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        run.setTableRowCounts(loaded);
        run.setFailedTables(failed);
        if (!failed.isEmpty()) {
            throw new PipelineStageException(PipelineStage.LOAD, ErrorCategory.LOAD_ERROR,
                    String.format("%d of %d table(s) failed to load: %s", failed.size(), tables.size(), failed),
                    firstFailure);
        }
        return target;
    }

    private ValidationResult buildAnalytics(WarehouseTarget target, long expectedRows) {
        ValidationResult result = analyticsViewBuilder.materialize(target, expectedRows);
        if (!result.isPassed()) {
            throw new PipelineStageException(PipelineStage.ANALYTICS, ErrorCategory.VALIDATION_ERROR,
                    result.getDetail(), null);
        }
        return result;
    }

    private PipelineRunResponse finish(PipelineRun run, RunStatus status, String message) {
        run.setStatus(status);
        run.setFinishedAt(Instant.now());
        runStore.save(run);
        metrics.recordRun(status.name());

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("status", status.name());
        ctx.put("factRows", run.getFactRows());
        ctx.put("rejectedRows", run.getRejectedRows());
        ctx.put("orphanRows", run.getOrphanRows());
        if (run.getFailedStage() != null) {
            ctx.put("failedStage", run.getFailedStage().name());
            ctx.put("errorCategory", run.getErrorCategory());
        }
        eventLogger.logEvent(status == RunStatus.SUCCEEDED ? "PIPELINE_RUN_COMPLETED" : "PIPELINE_RUN_FAILED",
                ctx, run.getRunId(), "pipeline_run");

        log.info("[PIPELINE] run {} {}: {}", run.getRunId(), status, message);
        return PipelineRunResponse.from(run, message);
    }
}

package com.di.tripstar.pipeline;

import com.di.tripstar.TripFixtures;
import com.di.tripstar.analytics.AnalyticsViewBuilder;
import com.di.tripstar.aspect.ErrorCategory;
import com.di.tripstar.config.TripStarProperties;
import com.di.tripstar.extract.RawTripExtractor;
import com.di.tripstar.extract.TripInputException;
import com.di.tripstar.pipeline.dto.PipelineRunRequest;
import com.di.tripstar.pipeline.dto.PipelineRunResponse;
import com.di.tripstar.transform.dimension.DimensionBuilder;
import com.di.tripstar.transform.dimension.RateCodeDimension;
import com.di.tripstar.transform.dimension.TripDimensions;
import com.di.tripstar.transform.fact.FactBuilder;
import com.di.tripstar.transform.fact.FactTable;
import com.di.tripstar.util.PipelineMetrics;
import com.di.tripstar.util.TransactionEventLogger;
import com.di.tripstar.warehouse.TableLoadResult;
import com.di.tripstar.warehouse.ValidationResult;
import com.di.tripstar.warehouse.WarehouseLoadException;
import com.di.tripstar.warehouse.WarehouseLoader;
import com.di.tripstar.warehouse.WarehouseTable;
import com.di.tripstar.warehouse.WarehouseTarget;
import com.di.tripstar.warehouse.WarehouseTargetResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("TripStarPipeline Tests")
class TripStarPipelineTest {

    private static final String SOURCE = "gs://uber-raw/uber_data.csv";

    private final WarehouseTarget target = WarehouseTarget.of("proj-123", "uber_ds");

    private RawTripExtractor         extractor;
    private WarehouseLoader          loader;
    private AnalyticsViewBuilder     analytics;
    private WarehouseTargetResolver  resolver;
    private InMemoryPipelineRunStore runStore;
    private SimpleMeterRegistry      registry;
    private TripStarProperties       properties;
    private TripStarPipeline         pipeline;

    @BeforeEach
    void setUp() {
        extractor  = mock(RawTripExtractor.class);
        loader     = mock(WarehouseLoader.class);
        analytics  = mock(AnalyticsViewBuilder.class);
        resolver   = mock(WarehouseTargetResolver.class);
        runStore   = new InMemoryPipelineRunStore();
        registry   = new SimpleMeterRegistry();
        properties = new TripStarProperties();
        properties.getSource().setUri(SOURCE);

        when(extractor.extract(anyString())).thenReturn(TripFixtures.sample());
        when(resolver.resolve(any())).thenReturn(target);
        when(loader.load(any(WarehouseTarget.class), any(WarehouseTable.class))).thenAnswer(inv -> {
            WarehouseTable table = inv.getArgument(1);
            return TableLoadResult.builder()
                    .tableName(table.getName())
                    .expectedRows(table.rowCount())
                    .loadedRows(table.rowCount())
                    .build();
        });
        when(analytics.materialize(any(WarehouseTarget.class), anyLong()))
                .thenReturn(ValidationResult.builder().passed(true).expectedRows(8).actualRows(8).build());

        pipeline = new TripStarPipeline(extractor, new DimensionBuilder(), new FactBuilder(), loader, analytics,
                resolver, runStore, new PipelineMetrics(registry), new TransactionEventLogger("tripstar"), properties);
    }

    // ============================================================================
    // Successful runs
    // ============================================================================

    @Test
    @DisplayName("Should run every stage and report the data-quality counters")
    void testSuccessfulRun() {
        PipelineRunResponse response = pipeline.run(null);

        assertEquals("SUCCEEDED", response.getStatus());
        assertTrue(response.getRunId().startsWith("run-"));
        assertEquals(9, response.getRawRows());
        assertEquals(1, response.getRejectedRows());
        assertEquals(1, response.getDuplicateRows());
        assertEquals(0, response.getOrphanRows());
        assertEquals(8, response.getFactRows());
        assertEquals(8, response.getAnalyticsRows());
        assertEquals(8, response.getTableRowCounts().size());
        assertEquals(8L, response.getTableRowCounts().get(FactTable.TABLE));
        assertTrue(response.getFailedTables().isEmpty());
        assertNull(response.getFailedStage());

        verify(extractor).extract(SOURCE);
        verify(loader, times(8)).load(eq(target), any(WarehouseTable.class));
        verify(analytics).materialize(target, 8L);
        assertFalse(pipeline.isRunning());
        assertNull(MDC.get("jobId"));
    }

    @Test
    @DisplayName("Should record the finished run and its metrics")
    void testRunRecorded() {
        PipelineRunResponse response = pipeline.run(new PipelineRunRequest());

        PipelineRun stored = runStore.findById(response.getRunId()).orElseThrow();
        assertEquals(RunStatus.SUCCEEDED, stored.getStatus());
        assertEquals(PipelineStage.ANALYTICS, stored.getCurrentStage());
        assertEquals("proj-123", stored.getProject());
        assertEquals("uber_ds", stored.getDataset());
        assertNotNull(stored.getFinishedAt());

        assertEquals(1.0, registry.get("tripstar.runs.total").tag("status", "SUCCEEDED").counter().count());
        assertEquals(8.0, registry.get("tripstar.tables.loaded").tag("status", "success").counter().count());
        assertEquals(9.0, registry.get("tripstar.rows.extracted").counter().count());
        assertEquals(1.0, registry.get("tripstar.rows.rejected").counter().count());
    }

    @Test
    @DisplayName("Should prefer the request's source and dataset over configuration")
    void testRequestOverrides() {
        PipelineRunRequest request = PipelineRunRequest.builder()
                .sourceUri("gs://uber-raw/2016/other.csv")
                .dataset("other_ds")
                .build();

        pipeline.run(request);

        verify(extractor).extract("gs://uber-raw/2016/other.csv");
        verify(resolver).resolve("other_ds");
    }

    @Test
    @DisplayName("Dry run should build the star schema without touching the warehouse")
    void testDryRun() {
        PipelineRunResponse response = pipeline.run(PipelineRunRequest.builder().dryRun(true).build());

        assertEquals("SUCCEEDED", response.getStatus());
        assertTrue(response.isDryRun());
        assertEquals(8, response.getFactRows());
        assertTrue(response.getTableRowCounts().isEmpty());
        verify(loader, never()).load(any(), any());
        verify(analytics, never()).materialize(any(), anyLong());
        verify(resolver, never()).resolve(any());
    }

    @Test
    @DisplayName("Configured dry run applies when the request does not say")
    void testConfiguredDryRun() {
        properties.getPipeline().setDryRun(true);

        pipeline.run(null);

        verify(loader, never()).load(any(), any());
    }

    // ============================================================================
    // Failed runs
    // ============================================================================

    @Test
    @DisplayName("Should fail at EXTRACT with INPUT_ERROR and stop")
    void testExtractFailure() {
        when(extractor.extract(anyString())).thenThrow(new TripInputException("No valid trip rows in " + SOURCE));

        PipelineRunResponse response = pipeline.run(null);

        assertEquals("FAILED", response.getStatus());
        assertEquals("EXTRACT", response.getFailedStage());
        assertEquals(ErrorCategory.INPUT_ERROR.name(), response.getErrorCategory());
        assertTrue(response.getMessage().contains("No valid trip rows"));
        verify(loader, never()).load(any(), any());
        assertFalse(pipeline.isRunning());
        assertEquals(1, runStore.findByStatus(RunStatus.FAILED).size());
    }

    @Test
    @DisplayName("Should attempt every table and name the ones that failed")
    void testPartialLoadFailure() {
        when(loader.load(any(WarehouseTarget.class), any(WarehouseTable.class))).thenAnswer(inv -> {
            WarehouseTable table = inv.getArgument(1);
            if (table.getName().equals(RateCodeDimension.TABLE)) {
                throw new WarehouseLoadException(table.getName(), "BigQuery rejected load of " + table.getName());
            }
            return TableLoadResult.builder().tableName(table.getName()).loadedRows(table.rowCount()).build();
        });

        PipelineRunResponse response = pipeline.run(null);

        assertEquals("FAILED", response.getStatus());
        assertEquals("LOAD", response.getFailedStage());
        assertEquals(ErrorCategory.LOAD_ERROR.name(), response.getErrorCategory());
        assertEquals(List.of(RateCodeDimension.TABLE), response.getFailedTables());
        assertEquals(7, response.getTableRowCounts().size());
        assertTrue(response.getMessage().contains("1 of 8 table(s) failed to load"));
        verify(loader, times(8)).load(any(), any());
        verify(analytics, never()).materialize(any(), anyLong());
        assertEquals(1.0, registry.get("tripstar.tables.loaded").tag("status", "error").counter().count());
    }

    @Test
    @DisplayName("Should fail at ANALYTICS when the analytics count does not reconcile")
    void testAnalyticsMismatch() {
        when(analytics.materialize(any(WarehouseTarget.class), anyLong())).thenReturn(ValidationResult.builder()
                .passed(false).expectedRows(8).actualRows(6).detail("tbl_analytics: expected=8 actual=6").build());

        PipelineRunResponse response = pipeline.run(null);

        assertEquals("FAILED", response.getStatus());
        assertEquals("ANALYTICS", response.getFailedStage());
        assertEquals(ErrorCategory.VALIDATION_ERROR.name(), response.getErrorCategory());
        assertTrue(response.getMessage().contains("expected=8 actual=6"));
    }

    @Test
    @DisplayName("A failure between stages should still finish the run as FAILED")
    void testFailureBetweenStages() {
        TripDimensions dimensions = mock(TripDimensions.class);
        when(dimensions.totalConflicts()).thenThrow(new IllegalStateException("conflict count unavailable"));
        DimensionBuilder dimensionBuilder = mock(DimensionBuilder.class);
        when(dimensionBuilder.buildAll(any())).thenReturn(dimensions);
        TripStarPipeline failing = new TripStarPipeline(extractor, dimensionBuilder, new FactBuilder(), loader, analytics,
                resolver, runStore, new PipelineMetrics(registry), new TransactionEventLogger("tripstar"), properties);

        PipelineRunResponse response = failing.run(null);

        assertEquals("FAILED", response.getStatus());
        assertEquals("BUILD_DIMENSIONS", response.getFailedStage());
        assertEquals(ErrorCategory.VALIDATION_ERROR.name(), response.getErrorCategory());
        assertEquals("conflict count unavailable", response.getMessage());
        PipelineRun stored = runStore.findById(response.getRunId()).orElseThrow();
        assertEquals(RunStatus.FAILED, stored.getStatus());
        assertNotNull(stored.getFinishedAt());
        assertFalse(failing.isRunning());
        assertEquals(1.0, registry.get("tripstar.runs.total").tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("A run store failure at a stage boundary should fail that stage")
    void testRunStoreFailureAtStage() {
        AtomicBoolean failed = new AtomicBoolean();
        PipelineRunStore flaky = new InMemoryPipelineRunStore() {
            @Override
            public void save(PipelineRun run) {
                if (run.getCurrentStage() == PipelineStage.LOAD && failed.compareAndSet(false, true)) {
                    throw new IllegalStateException("run store unavailable");
                }
                super.save(run);
            }
        };
        TripStarPipeline pipelineWithFlakyStore = new TripStarPipeline(extractor, new DimensionBuilder(), new FactBuilder(),
                loader, analytics, resolver, flaky, new PipelineMetrics(registry), new TransactionEventLogger("tripstar"),
                properties);

        PipelineRunResponse response = pipelineWithFlakyStore.run(null);

        assertEquals("FAILED", response.getStatus());
        assertEquals("LOAD", response.getFailedStage());
        assertEquals(RunStatus.FAILED, flaky.findById(response.getRunId()).orElseThrow().getStatus());
        verify(loader, never()).load(any(), any());
    }

    // ============================================================================
    // Concurrency
    // ============================================================================

    @Test
    @DisplayName("Should refuse a second run while one is active")
    void testConcurrentRunRejected() {
        AtomicReference<RuntimeException> rejected = new AtomicReference<>();
        AtomicBoolean runningDuringLoad = new AtomicBoolean();
        when(loader.load(any(WarehouseTarget.class), any(WarehouseTable.class))).thenAnswer(inv -> {
            WarehouseTable table = inv.getArgument(1);
            if (rejected.get() == null) {
                runningDuringLoad.set(pipeline.isRunning());
                try {
                    pipeline.run(null);
                } catch (ConcurrentRunException e) {
                    rejected.set(e);
                }
            }
            return TableLoadResult.builder().tableName(table.getName()).loadedRows(table.rowCount()).build();
        });

        PipelineRunResponse response = pipeline.run(null);

        assertEquals("SUCCEEDED", response.getStatus());
        assertTrue(runningDuringLoad.get());
        assertInstanceOf(ConcurrentRunException.class, rejected.get());
        assertEquals(response.getRunId(), ((ConcurrentRunException) rejected.get()).getActiveRunId());
        assertFalse(pipeline.isRunning());

        // a new run may start once the first has finished
        assertEquals("SUCCEEDED", pipeline.run(null).getStatus());
    }
}

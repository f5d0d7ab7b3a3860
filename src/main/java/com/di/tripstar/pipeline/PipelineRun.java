package com.di.tripstar.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping record of one pipeline run: where it is, what it counted, and
 * why it failed if it did.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRun {

    private String        runId;
    private RunStatus     status;
    private PipelineStage currentStage;
    private boolean       dryRun;

    private String sourceUri;
    private String project;
    private String dataset;

    private Instant startedAt;
    private Instant finishedAt;

    // ---- data-quality counters ---------------------------------------------
    private long rawRows;
    private long rejectedRows;
    private long duplicateRows;
    private long orphanRows;
    private long duplicateKeyConflicts;
    private long factRows;
    private long analyticsRows;

    // ---- load outcome ------------------------------------------------------
    @Builder.Default
    private Map<String, Long> tableRowCounts = new LinkedHashMap<>();
    @Builder.Default
    private List<String> failedTables = new ArrayList<>();

    // ---- failure -----------------------------------------------------------
    private PipelineStage failedStage;
    private String        errorCategory;
    private String        errorMessage;

    /** Copy whose collections are not shared with this run. */
    public PipelineRun snapshot() {
        return toBuilder()
                .tableRowCounts(new LinkedHashMap<>(tableRowCounts))
                .failedTables(new ArrayList<>(failedTables))
                .build();
    }
}

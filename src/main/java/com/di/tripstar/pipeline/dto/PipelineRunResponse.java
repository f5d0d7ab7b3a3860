package com.di.tripstar.pipeline.dto;

import com.di.tripstar.pipeline.PipelineRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST response for a triggered run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunResponse {

    private String  runId;

    /** SUCCEEDED or FAILED. */
    private String  status;
    private boolean dryRun;

    private long rawRows;
    private long rejectedRows;
    private long duplicateRows;
    private long orphanRows;
    private long factRows;
    private long analyticsRows;

    private Map<String, Long> tableRowCounts;
    private List<String>      failedTables;

    /** Stage that failed, if any. */
    private String failedStage;
    private String errorCategory;

    /** Human-readable summary or error detail. */
    private String message;

    private long durationMs;

    public static PipelineRunResponse from(PipelineRun run, String message) {
        long durationMs = run.getStartedAt() != null && run.getFinishedAt() != null
                ? run.getFinishedAt().toEpochMilli() - run.getStartedAt().toEpochMilli()
                : 0L;
        return PipelineRunResponse.builder()
                .runId(run.getRunId())
                .status(run.getStatus() != null ? run.getStatus().name() : null)
                .dryRun(run.isDryRun())
                .rawRows(run.getRawRows())
                .rejectedRows(run.getRejectedRows())
                .duplicateRows(run.getDuplicateRows())
                .orphanRows(run.getOrphanRows())
                .factRows(run.getFactRows())
                .analyticsRows(run.getAnalyticsRows())
                .tableRowCounts(new LinkedHashMap<>(run.getTableRowCounts()))
                .failedTables(List.copyOf(run.getFailedTables()))
                .failedStage(run.getFailedStage() != null ? run.getFailedStage().name() : null)
                .errorCategory(run.getErrorCategory())
                .message(message)
                .durationMs(durationMs)
                .build();
    }
}

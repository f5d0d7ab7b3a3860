package com.di.tripstar.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * Keeps run records for status queries.
 */
public interface PipelineRunStore {

    void save(PipelineRun run);

    Optional<PipelineRun> findById(String runId);

    /** Runs with {@code status}, most recent first. */
    List<PipelineRun> findByStatus(RunStatus status);

    /** All retained runs, most recent first. */
    List<PipelineRun> findAll();
}

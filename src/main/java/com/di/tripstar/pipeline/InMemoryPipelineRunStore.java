package com.di.tripstar.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory run registry. Keeps the most recent {@value #MAX_RUNS} runs; older
 * ones are evicted in insertion order. Records are stored and returned as
 * snapshots, so callers never share state with the running pipeline.
 */
@Slf4j
@Repository
public class InMemoryPipelineRunStore implements PipelineRunStore {

    static final int MAX_RUNS = 100;

    private final Map<String, PipelineRun> runs = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, PipelineRun> eldest) {
                    return size() > MAX_RUNS;
                }
            });

    @Override
    public void save(PipelineRun run) {
        if (run == null || run.getRunId() == null) {
            throw new IllegalArgumentException("Run and runId must not be null");
        }
        runs.put(run.getRunId(), run.snapshot());
        log.debug("[RUNS] saved {} status={} stage={}", run.getRunId(), run.getStatus(), run.getCurrentStage());
    }

    @Override
    public Optional<PipelineRun> findById(String runId) {
        PipelineRun run = runs.get(runId);
        return run == null ? Optional.empty() : Optional.of(run.snapshot());
    }

    @Override
    public List<PipelineRun> findByStatus(RunStatus status) {
        return findAll().stream().filter(r -> r.getStatus() == status).toList();
    }

    @Override
    public List<PipelineRun> findAll() {
        List<PipelineRun> copy;
        synchronized (runs) {
            copy = new ArrayList<>(runs.values());
        }
        copy.sort(Comparator.comparing(PipelineRun::getStartedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return copy.stream().map(PipelineRun::snapshot).toList();
    }
}

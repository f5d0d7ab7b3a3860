package com.di.tripstar.pipeline;

import com.di.tripstar.pipeline.dto.PipelineRunRequest;
import com.di.tripstar.pipeline.dto.PipelineRunResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for pipeline runs.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/pipeline/runs</td>
 *     <td>Trigger a run (synchronous); 409 while another run is active</td></tr>
 * <tr><td>GET</td><td>/api/pipeline/runs/{runId}</td>
 *     <td>Fetch a run record</td></tr>
 * <tr><td>GET</td><td>/api/pipeline/runs?status=FAILED</td>
 *     <td>List runs, optionally by status</td></tr>
 * </table>
 */
@RestController
@RequestMapping("/api/pipeline")
@Slf4j
@RequiredArgsConstructor
public class PipelineRunController {

    private final TripStarPipeline pipeline;
    private final PipelineRunStore runStore;

    /**
     * Returns {@code 201 Created} when the run succeeds and {@code 500} with the
     * failing stage and category when it does not.
     */
    @PostMapping("/runs")
    public ResponseEntity<PipelineRunResponse> triggerRun(
            @Valid @RequestBody(required = false) PipelineRunRequest request) {

        log.info("[CONTROLLER] POST /api/pipeline/runs source={} dataset={} dryRun={}",
                 request != null ? request.getSourceUri() : null,
                 request != null ? request.getDataset() : null,
                 request != null ? request.getDryRun() : null);

        PipelineRunResponse response = pipeline.run(request);

        HttpStatus status = RunStatus.FAILED.name().equals(response.getStatus())
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<PipelineRun> getRun(@PathVariable String runId) {
        return runStore.findById(runId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/runs")
    public List<PipelineRun> listRuns(@RequestParam(required = false) RunStatus status) {
        return status != null ? runStore.findByStatus(status) : runStore.findAll();
    }
}

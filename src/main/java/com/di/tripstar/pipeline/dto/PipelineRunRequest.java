package com.di.tripstar.pipeline.dto;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of {@code POST /api/pipeline/runs}; every field falls back to
 * {@code tripstar.*} configuration when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunRequest {

    /**
     * Raw trip CSV in Cloud Storage, e.g. {@code gs://bucket/uber_data.csv}. Local
     * files are only read from {@code tripstar.source.uri}, never from a request.
     */
    @Pattern(regexp = "^gs://[a-z0-9][a-z0-9._-]{1,220}[a-z0-9]/\\S+$",
             message = "sourceUri must be a gs://bucket/object location")
    private String sourceUri;

    /** Target BigQuery dataset. */
    @Pattern(regexp = "^[A-Za-z_][A-Za-z0-9_]*$", message = "dataset must contain only letters, digits and underscores")
    private String dataset;

    /** Build the star schema without loading it. */
    private Boolean dryRun;
}

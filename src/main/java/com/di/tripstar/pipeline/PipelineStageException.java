package com.di.tripstar.pipeline;

import com.di.tripstar.aspect.ErrorCategory;
import lombok.Getter;

/**
 * A stage failed; carries the stage and the category of the underlying error.
 */
@Getter
public class PipelineStageException extends RuntimeException {

    private final PipelineStage stage;
    private final ErrorCategory category;

    public PipelineStageException(PipelineStage stage, ErrorCategory category, String message, Throwable cause) {
        super(stage + " failed: " + message, cause);
        this.stage    = stage;
        this.category = category;
    }
}

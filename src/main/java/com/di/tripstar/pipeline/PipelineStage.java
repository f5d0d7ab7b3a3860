package com.di.tripstar.pipeline;

/**
 * Stages of a run, in execution order.
 */
public enum PipelineStage {
    EXTRACT,
    BUILD_DIMENSIONS,
    BUILD_FACTS,
    LOAD,
    ANALYTICS
}

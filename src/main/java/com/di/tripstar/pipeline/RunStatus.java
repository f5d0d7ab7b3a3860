package com.di.tripstar.pipeline;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED
}

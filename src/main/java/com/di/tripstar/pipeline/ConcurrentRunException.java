package com.di.tripstar.pipeline;

import lombok.Getter;

/**
 * A run was requested while another run of this process is still in progress.
 */
@Getter
public class ConcurrentRunException extends RuntimeException {

    private final String activeRunId;

    public ConcurrentRunException(String activeRunId) {
        super("Pipeline run " + activeRunId + " is still in progress");
        this.activeRunId = activeRunId;
    }
}

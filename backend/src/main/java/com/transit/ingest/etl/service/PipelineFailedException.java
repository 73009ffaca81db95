package com.transit.ingest.etl.service;

import com.transit.ingest.etl.model.PipelineState;

/**
 * Terminal outcome of a run that did not reach {@link PipelineState#DONE}. The cause is the
 * error raised by {@link #failedStage()}.
 */
public class PipelineFailedException extends RuntimeException {
    private final String dataset;
    private final PipelineState failedStage;

    public PipelineFailedException(String dataset, PipelineState failedStage, Throwable cause) {
        super("Pipeline run for " + dataset + " failed during " + failedStage + ": " + cause.getMessage(), cause);
        this.dataset = dataset;
        this.failedStage = failedStage;
    }

    public String dataset() {
        return dataset;
    }

    public PipelineState failedStage() {
        return failedStage;
    }
}

package com.transit.ingest.etl.model;

public enum PipelineState {
    IDLE,
    EXTRACTING,
    TRANSFORMING,
    LOADING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}

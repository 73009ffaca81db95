package com.transit.ingest.etl.service;

import com.transit.ingest.etl.model.PipelineState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one pipeline execution. States only move forward:
 * IDLE, EXTRACTING, TRANSFORMING, LOADING, then DONE; any non-terminal state may move to FAILED.
 */
public class PipelineRun {
    private final String dataset;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final List<PipelineState> history = new ArrayList<>();
    private PipelineState state = PipelineState.IDLE;
    private PipelineState failedStage;
    private Throwable failure;

    public PipelineRun(String dataset) {
        this.dataset = dataset;
        history.add(PipelineState.IDLE);
    }

    public String dataset() {
        return dataset;
    }

    public synchronized PipelineState state() {
        return state;
    }

    public synchronized List<PipelineState> history() {
        return List.copyOf(history);
    }

    public synchronized Throwable failure() {
        return failure;
    }

    public synchronized PipelineState failedStage() {
        return failedStage;
    }

    /** Asks the run to stop at the next stage, page or batch boundary. */
    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    synchronized void advanceTo(PipelineState next) {
        if (next == PipelineState.FAILED || state.isTerminal() || next.ordinal() != state.ordinal() + 1) {
            throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next);
        }
        state = next;
        history.add(next);
    }

    synchronized void fail(Throwable cause) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run for " + dataset + " already finished as " + state);
        }
        failedStage = state;
        failure = cause;
        state = PipelineState.FAILED;
        history.add(PipelineState.FAILED);
    }
}

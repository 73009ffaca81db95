package com.transit.ingest.etl.service;

import com.transit.ingest.etl.model.FailedBatch;

/**
 * Raised in fail-fast mode when a batch could not be committed.
 */
public class BatchWriteException extends RuntimeException {
    private final FailedBatch failedBatch;

    public BatchWriteException(FailedBatch failedBatch, Throwable cause) {
        super("Batch " + failedBatch.batchIndex() + " (" + failedBatch.records().size() + " records) failed: "
            + failedBatch.errorMessage(), cause);
        this.failedBatch = failedBatch;
    }

    public FailedBatch failedBatch() {
        return failedBatch;
    }
}

package com.transit.ingest.etl.model;

import java.util.List;

public record FailedBatch(int batchIndex, List<CleanRecord> records, String errorMessage) {
    public FailedBatch {
        records = List.copyOf(records);
    }
}

package com.transit.ingest.etl.model;

import java.util.List;

public record LoadResult(
    int insertedCount,
    int updatedCount,
    int unchangedCount,
    List<FailedBatch> failedBatches
) {
    public LoadResult {
        failedBatches = List.copyOf(failedBatches);
    }

    public static LoadResult empty() {
        return new LoadResult(0, 0, 0, List.of());
    }

    public int persistedCount() {
        return insertedCount + updatedCount + unchangedCount;
    }

    public int failedRecordCount() {
        return failedBatches.stream().mapToInt(batch -> batch.records().size()).sum();
    }
}

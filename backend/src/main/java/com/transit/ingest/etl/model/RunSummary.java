package com.transit.ingest.etl.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RunSummary(
    String dataset,
    PipelineState status,
    Instant startedAt,
    Instant finishedAt,
    int pagesFetched,
    boolean truncated,
    int extractedCount,
    int cleanedCount,
    int duplicatesCollapsed,
    List<RejectedRecord> rejected,
    LoadResult load
) {
    public RunSummary {
        rejected = List.copyOf(rejected);
    }

    public int rejectedCount() {
        return rejected.size();
    }

    public Map<String, Integer> rejectsByReason() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RejectedRecord record : rejected) {
            RejectReason reason = record.reason();
            String key = reason.field() == null ? reason.type().name() : reason.type() + ":" + reason.field();
            counts.merge(key, 1, Integer::sum);
        }
        return counts;
    }

    public boolean isPartialSuccess() {
        return !rejected.isEmpty() || !load.failedBatches().isEmpty() || truncated;
    }
}

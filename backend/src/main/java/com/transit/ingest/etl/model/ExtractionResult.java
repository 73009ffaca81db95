package com.transit.ingest.etl.model;

import java.time.Instant;
import java.util.List;

public record ExtractionResult(
    List<RawRecord> records,
    int pagesFetched,
    boolean truncated,
    Instant startedAt,
    Instant finishedAt
) {
    public ExtractionResult {
        records = List.copyOf(records);
    }
}

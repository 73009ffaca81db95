package com.transit.ingest.etl.model;

import java.util.List;

/**
 * Output of the transform stage. {@code rowsExpanded} counts the extra rows produced when a
 * record with an exploded field yields more than one row.
 */
public record TransformResult(
    List<CleanRecord> clean,
    List<RejectedRecord> rejected,
    int duplicatesCollapsed,
    int rowsExpanded
) {
    public TransformResult {
        clean = List.copyOf(clean);
        rejected = List.copyOf(rejected);
    }

    public TransformResult(List<CleanRecord> clean, List<RejectedRecord> rejected, int duplicatesCollapsed) {
        this(clean, rejected, duplicatesCollapsed, 0);
    }

    public int inputCount() {
        return clean.size() + rejected.size() + duplicatesCollapsed - rowsExpanded;
    }
}

package com.transit.ingest.etl.model;

import com.transit.ingest.etl.contract.DataContract;

public record LoadTarget(DataContract contract, int batchSize, boolean failFast) {
    public LoadTarget {
        if (contract == null) {
            throw new IllegalArgumentException("contract is required");
        }
        batchSize = Math.max(1, batchSize);
    }
}

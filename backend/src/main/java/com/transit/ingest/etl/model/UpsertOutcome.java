package com.transit.ingest.etl.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
}

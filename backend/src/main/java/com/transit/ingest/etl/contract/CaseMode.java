package com.transit.ingest.etl.contract;

public enum CaseMode {
    NONE,
    UPPER,
    LOWER
}

package com.transit.ingest.etl.model;

public enum PaginationMode {
    NONE,
    OFFSET,
    PAGE,
    CURSOR
}

package com.transit.ingest.etl.model;

public enum RejectType {
    MALFORMED_RECORD,
    TYPE_COERCION,
    VALIDATION
}

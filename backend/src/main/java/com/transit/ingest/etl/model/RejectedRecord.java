package com.transit.ingest.etl.model;

public record RejectedRecord(RawRecord raw, RejectReason reason) {
}

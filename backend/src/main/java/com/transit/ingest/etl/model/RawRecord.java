package com.transit.ingest.etl.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One element of a parsed page, untouched. {@code position} is the index within its page.
 */
public record RawRecord(
    int pageIndex,
    int position,
    JsonNode payload,
    Instant extractedAt
) {
    public boolean isMapping() {
        return payload != null && payload.isObject();
    }
}

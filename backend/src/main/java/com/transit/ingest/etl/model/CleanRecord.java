package com.transit.ingest.etl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A record that satisfies its contract. {@code values} is keyed by column name in contract
 * order and may hold nulls for optional fields.
 */
public record CleanRecord(NaturalKey key, Map<String, Object> values) {
    public CleanRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        return values.get(column);
    }
}

package com.transit.ingest.etl.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Values of the natural-key fields in contract order. Decimals are compared by value, so
 * {@code 1.50} and {@code 1.5} are the same key.
 */
public record NaturalKey(List<Object> values) {
    public NaturalKey {
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException("Natural key values cannot be null");
            }
            normalized.add(value instanceof BigDecimal decimal ? decimal.stripTrailingZeros() : value);
        }
        values = List.copyOf(normalized);
    }

    public static NaturalKey of(Object... values) {
        return new NaturalKey(List.of(values));
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

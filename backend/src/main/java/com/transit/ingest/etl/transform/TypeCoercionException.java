package com.transit.ingest.etl.transform;

import com.transit.ingest.etl.contract.FieldType;

public class TypeCoercionException extends RuntimeException {
    private final String field;
    private final String rawValue;
    private final FieldType targetType;

    public TypeCoercionException(String field, String rawValue, FieldType targetType) {
        super("Cannot coerce " + field + "='" + rawValue + "' to " + targetType);
        this.field = field;
        this.rawValue = rawValue;
        this.targetType = targetType;
    }

    public String field() {
        return field;
    }

    public String rawValue() {
        return rawValue;
    }

    public FieldType targetType() {
        return targetType;
    }
}

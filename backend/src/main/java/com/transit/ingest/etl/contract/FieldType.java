package com.transit.ingest.etl.contract;

/**
 * Semantic type of a contract field and the column type it is stored as.
 */
public enum FieldType {
    STRING,
    INTEGER,
    DECIMAL,
    DATE,
    TIMESTAMP,
    BOOLEAN;

    public static final int DEFAULT_STRING_LENGTH = 255;
    public static final int DECIMAL_PRECISION = 19;
    public static final int DECIMAL_SCALE = 6;
    public static final int DECIMAL_INTEGER_DIGITS = DECIMAL_PRECISION - DECIMAL_SCALE;

    public String sqlType(Integer maxLength) {
        return switch (this) {
            case STRING -> "VARCHAR(" + (maxLength == null ? DEFAULT_STRING_LENGTH : maxLength) + ")";
            case INTEGER -> "BIGINT";
            case DECIMAL -> "NUMERIC(" + DECIMAL_PRECISION + "," + DECIMAL_SCALE + ")";
            case DATE -> "DATE";
            case TIMESTAMP -> "TIMESTAMP";
            case BOOLEAN -> "BOOLEAN";
        };
    }
}

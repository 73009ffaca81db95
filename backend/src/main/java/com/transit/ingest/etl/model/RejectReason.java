package com.transit.ingest.etl.model;

public record RejectReason(
    RejectType type,
    String field,
    String rule,
    String rawValue,
    String targetType
) {
    public static RejectReason malformed(String found) {
        return new RejectReason(RejectType.MALFORMED_RECORD, null, "object", found, null);
    }

    public static RejectReason typeCoercion(String field, String rawValue, String targetType) {
        return new RejectReason(RejectType.TYPE_COERCION, field, null, rawValue, targetType);
    }

    public static RejectReason validation(String field, String rule, String value) {
        return new RejectReason(RejectType.VALIDATION, field, rule, value, null);
    }

    public String describe() {
        return switch (type) {
            case MALFORMED_RECORD -> "MALFORMED_RECORD(expected object, found " + rawValue + ")";
            case TYPE_COERCION -> "TYPE_COERCION(" + field + ", " + rawValue + ", " + targetType + ")";
            case VALIDATION -> "VALIDATION(" + field + ", " + rule + ", " + rawValue + ")";
        };
    }
}

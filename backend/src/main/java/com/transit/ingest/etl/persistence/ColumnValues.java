package com.transit.ingest.etl.persistence;

import com.transit.ingest.etl.contract.FieldType;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Conversions between clean record values and JDBC values. Dates and timestamps travel as
 * {@code java.time} objects in both directions, so no JVM time zone is applied.
 */
final class ColumnValues {
    private ColumnValues() {}

    static int sqlType(FieldType type) {
        return switch (type) {
            case STRING -> Types.VARCHAR;
            case INTEGER -> Types.BIGINT;
            case DECIMAL -> Types.NUMERIC;
            case DATE -> Types.DATE;
            case TIMESTAMP -> Types.TIMESTAMP;
            case BOOLEAN -> Types.BOOLEAN;
        };
    }

    static Object read(ResultSet rs, String column, FieldType type) throws SQLException {
        Object value = switch (type) {
            case DATE -> rs.getObject(column, LocalDate.class);
            case TIMESTAMP -> rs.getObject(column, LocalDateTime.class);
            default -> rs.getObject(column);
        };
        return fromJdbc(value, type);
    }

    static Object fromJdbc(Object value, FieldType type) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case STRING -> value.toString();
            case INTEGER -> value instanceof Number number ? number.longValue() : Long.valueOf(value.toString());
            case DECIMAL -> value instanceof BigDecimal decimal ? decimal : new BigDecimal(value.toString());
            case DATE, TIMESTAMP -> value;
            case BOOLEAN -> value instanceof Boolean flag ? flag : Boolean.valueOf(value.toString());
        };
    }

    static boolean sameValue(Object stored, Object candidate) {
        if (stored instanceof BigDecimal left && candidate instanceof BigDecimal right) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(stored, candidate);
    }
}

package com.transit.ingest.etl.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.transit.ingest.etl.contract.ContractField;
import com.transit.ingest.etl.contract.FieldType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts a normalized payload value to the Java type of its contract field.
 *
 * <p>Accepted inputs: integers from integral numbers or numeric strings with no fractional
 * part; decimals from any number or numeric string; dates as {@code yyyy-MM-dd},
 * {@code yyyy/MM/dd} or {@code MM/dd/yyyy}; timestamps as ISO local date-time,
 * {@code yyyy-MM-dd HH:mm:ss}, ISO offset date-time (converted to UTC) or epoch milliseconds;
 * flags as booleans, {@code 0/1}, {@code true/false}, {@code yes/no} or {@code y/n}.
 */
final class FieldCoercer {
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT),
        DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT)
    );
    private static final List<DateTimeFormatter> LOCAL_TIMESTAMP_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT)
    );
    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "y", "1");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "n", "0");

    private FieldCoercer() {}

    static Object coerce(ContractField field, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isContainerNode()) {
            throw failure(field, value);
        }
        return switch (field.type()) {
            case STRING -> value.asText();
            case INTEGER -> toLong(field, value);
            case DECIMAL -> toScaledDecimal(field, value);
            case DATE -> toDate(field, value);
            case TIMESTAMP -> toTimestamp(field, value).truncatedTo(ChronoUnit.MICROS);
            case BOOLEAN -> toFlag(field, value);
        };
    }

    private static Long toLong(ContractField field, JsonNode value) {
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        BigDecimal decimal = toDecimal(field, value);
        try {
            return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            throw failure(field, value);
        }
    }

    // Rounds HALF_UP to the column scale when the value carries more fraction digits.
    private static BigDecimal toScaledDecimal(ContractField field, JsonNode value) {
        BigDecimal decimal = toDecimal(field, value);
        return decimal.scale() > FieldType.DECIMAL_SCALE
            ? decimal.setScale(FieldType.DECIMAL_SCALE, RoundingMode.HALF_UP)
            : decimal;
    }

    private static BigDecimal toDecimal(ContractField field, JsonNode value) {
        if (value.isNumber()) {
            if (value.isFloatingPointNumber() && !Double.isFinite(value.doubleValue())) {
                throw failure(field, value);
            }
            return value.decimalValue();
        }
        if (!value.isTextual()) {
            throw failure(field, value);
        }
        try {
            return new BigDecimal(value.asText());
        } catch (NumberFormatException e) {
            throw failure(field, value);
        }
    }

    private static LocalDate toDate(ContractField field, JsonNode value) {
        if (!value.isTextual()) {
            throw failure(field, value);
        }
        String text = value.asText();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // try the next accepted format
            }
        }
        throw failure(field, value);
    }

    private static LocalDateTime toTimestamp(ContractField field, JsonNode value) {
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return fromEpochMillis(value.longValue());
        }
        if (!value.isTextual()) {
            throw failure(field, value);
        }
        String text = value.asText();
        if (text.chars().allMatch(Character::isDigit) && text.length() <= 18) {
            return fromEpochMillis(Long.parseLong(text));
        }
        for (DateTimeFormatter format : LOCAL_TIMESTAMP_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // try the next accepted format
            }
        }
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            throw failure(field, value);
        }
    }

    private static Boolean toFlag(ContractField field, JsonNode value) {
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        String text = value.asText().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(text)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(text)) {
            return Boolean.FALSE;
        }
        throw failure(field, value);
    }

    private static LocalDateTime fromEpochMillis(long millis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
    }

    static String rawText(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    private static TypeCoercionException failure(ContractField field, JsonNode value) {
        return new TypeCoercionException(field.name(), rawText(value), field.type());
    }
}

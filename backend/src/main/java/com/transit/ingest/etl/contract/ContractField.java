package com.transit.ingest.etl.contract;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One column of a {@link DataContract}.
 *
 * <p>{@code sourceName} is the field name in the API payload; {@code name} is the column name.
 * {@code defaultValue} is applied, as if it were the source value, when the payload has no
 * value for the field. Fields marked {@code extractionTime} ignore the payload and carry the
 * timestamp at which the record was extracted. An {@code exploded} field reads an array from
 * the payload and yields one row per element, the other fields repeated on each row.
 */
public record ContractField(
    String name,
    String sourceName,
    FieldType type,
    boolean required,
    Integer maxLength,
    CaseMode caseMode,
    Set<String> allowedValues,
    BigDecimal min,
    BigDecimal max,
    String defaultValue,
    boolean extractionTime,
    boolean exploded
) {
    static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]*");

    public ContractField {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid column name: " + name);
        }
        if (type == null) {
            throw new IllegalArgumentException("Field " + name + " has no type");
        }
        if (extractionTime && type != FieldType.TIMESTAMP) {
            throw new IllegalArgumentException("Extraction time field " + name + " must be a TIMESTAMP");
        }
        if (exploded && extractionTime) {
            throw new IllegalArgumentException("Field " + name + " cannot be both exploded and extraction time");
        }
        sourceName = sourceName == null || sourceName.isBlank() ? name : sourceName;
        caseMode = caseMode == null ? CaseMode.NONE : caseMode;
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
    }

    public static Builder string(String name) {
        return new Builder(name, FieldType.STRING);
    }

    public static Builder integer(String name) {
        return new Builder(name, FieldType.INTEGER);
    }

    public static Builder decimal(String name) {
        return new Builder(name, FieldType.DECIMAL);
    }

    public static Builder date(String name) {
        return new Builder(name, FieldType.DATE);
    }

    public static Builder timestamp(String name) {
        return new Builder(name, FieldType.TIMESTAMP);
    }

    public static Builder flag(String name) {
        return new Builder(name, FieldType.BOOLEAN);
    }

    public String sqlType() {
        return type.sqlType(maxLength);
    }

    public static final class Builder {
        private final String name;
        private final FieldType type;
        private String sourceName;
        private boolean required;
        private Integer maxLength;
        private CaseMode caseMode = CaseMode.NONE;
        private final Set<String> allowedValues = new LinkedHashSet<>();
        private BigDecimal min;
        private BigDecimal max;
        private String defaultValue;
        private boolean extractionTime;
        private boolean exploded;

        private Builder(String name, FieldType type) {
            this.name = name;
            this.type = type;
        }

        public Builder from(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder upperCase() {
            this.caseMode = CaseMode.UPPER;
            return this;
        }

        public Builder lowerCase() {
            this.caseMode = CaseMode.LOWER;
            return this;
        }

        public Builder allowed(String... values) {
            allowedValues.addAll(Set.of(values));
            return this;
        }

        public Builder min(String min) {
            this.min = new BigDecimal(min);
            return this;
        }

        public Builder max(String max) {
            this.max = new BigDecimal(max);
            return this;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder extractionTime() {
            this.extractionTime = true;
            return this;
        }

        public Builder exploded() {
            this.exploded = true;
            return this;
        }

        public ContractField build() {
            return new ContractField(
                name,
                sourceName,
                type,
                required || extractionTime,
                maxLength,
                caseMode,
                allowedValues,
                min,
                max,
                defaultValue,
                extractionTime,
                exploded
            );
        }
    }
}

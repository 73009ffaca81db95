package com.transit.ingest.etl.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.transit.ingest.etl.contract.CaseMode;
import com.transit.ingest.etl.contract.ContractField;
import com.transit.ingest.etl.contract.DataContract;
import com.transit.ingest.etl.contract.FieldType;
import com.transit.ingest.etl.model.CleanRecord;
import com.transit.ingest.etl.model.NaturalKey;
import com.transit.ingest.etl.model.RawRecord;
import com.transit.ingest.etl.model.RejectReason;
import com.transit.ingest.etl.model.RejectedRecord;
import com.transit.ingest.etl.model.TransformResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.text.Normalizer;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw payload records into contract-conforming records.
 *
 * <p>Each record is normalized, coerced and validated on its own; the first failing field
 * rejects it. Survivors are then deduplicated by natural key with last-seen-wins: a later
 * record replaces an earlier one with the same key and takes its place at the later position.
 * A contract with an exploded field turns one raw record into one row per array element
 * before deduplication.
 */
@Service
public class RecordTransformer {
    private static final Logger log = LoggerFactory.getLogger(RecordTransformer.class);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    public TransformResult transform(List<RawRecord> records, DataContract contract) {
        List<RejectedRecord> rejected = new ArrayList<>();
        Map<NaturalKey, CleanRecord> survivors = new LinkedHashMap<>();
        int duplicates = 0;
        int expanded = 0;

        for (RawRecord raw : records) {
            RejectReason reason;
            List<Map<String, Object>> rows = new ArrayList<>();
            if (!raw.isMapping()) {
                reason = RejectReason.malformed(raw.payload() == null
                    ? "nothing"
                    : raw.payload().getNodeType().name().toLowerCase(Locale.ROOT));
            } else {
                reason = buildRows(raw, contract, rows);
            }

            if (reason != null) {
                log.debug("Rejected record {}#{} of {}: {}", raw.pageIndex(), raw.position(), contract.name(), reason.describe());
                rejected.add(new RejectedRecord(raw, reason));
                continue;
            }
            expanded += rows.size() - 1;
            for (Map<String, Object> values : rows) {
                CleanRecord clean = new CleanRecord(naturalKey(contract, values), values);
                if (survivors.remove(clean.key()) != null) {
                    duplicates++;
                }
                survivors.put(clean.key(), clean);
            }
        }

        TransformResult result = new TransformResult(new ArrayList<>(survivors.values()), rejected, duplicates, expanded);
        log.info(
            "Transformed {} records for {}: clean={}, rejected={}, duplicatesCollapsed={}, rowsExpanded={}",
            records.size(),
            contract.name(),
            result.clean().size(),
            rejected.size(),
            duplicates,
            expanded
        );
        return result;
    }

    /**
     * Builds the rows of one raw record. Without an exploded field this is a single row. With
     * one, each element of the source array yields a row; a scalar source yields one row and a
     * missing source or empty array is handled as an absent value. Any failing element rejects
     * the whole record.
     */
    private RejectReason buildRows(RawRecord raw, DataContract contract, List<Map<String, Object>> rows) {
        Map<String, Object> base = new LinkedHashMap<>();
        ContractField explodedField = null;
        List<Object> explodedValues = new ArrayList<>();
        for (ContractField field : contract.fields()) {
            if (field.extractionTime()) {
                Object value = LocalDateTime.ofInstant(raw.extractedAt(), ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
                RejectReason violation = validate(field, value);
                if (violation != null) {
                    return violation;
                }
                base.put(field.name(), value);
                continue;
            }
            JsonNode source = sourceValue(raw.payload(), field);
            if (field.exploded()) {
                explodedField = field;
                // placeholder keeps the column order of the contract
                base.put(field.name(), null);
                for (JsonNode element : elements(source)) {
                    RejectReason violation = resolve(field, element, explodedValues);
                    if (violation != null) {
                        return violation;
                    }
                }
                continue;
            }
            List<Object> single = new ArrayList<>(1);
            RejectReason violation = resolve(field, source, single);
            if (violation != null) {
                return violation;
            }
            base.put(field.name(), single.get(0));
        }

        if (explodedField == null) {
            rows.add(base);
            return null;
        }
        for (Object value : explodedValues) {
            Map<String, Object> row = new LinkedHashMap<>(base);
            row.put(explodedField.name(), value);
            rows.add(row);
        }
        return null;
    }

    private RejectReason resolve(ContractField field, JsonNode source, List<Object> values) {
        JsonNode normalized = normalize(field, source);
        if (normalized == null && field.defaultValue() != null) {
            normalized = normalize(field, TextNode.valueOf(field.defaultValue()));
        }
        Object value;
        try {
            value = FieldCoercer.coerce(field, normalized);
        } catch (TypeCoercionException e) {
            return RejectReason.typeCoercion(e.field(), FieldCoercer.rawText(source), e.targetType().name());
        }
        RejectReason violation = validate(field, value);
        if (violation != null) {
            return violation;
        }
        values.add(value);
        return null;
    }

    private static List<JsonNode> elements(JsonNode source) {
        if (source == null || !source.isArray()) {
            return Collections.singletonList(source);
        }
        if (source.isEmpty()) {
            return Collections.singletonList(null);
        }
        List<JsonNode> elements = new ArrayList<>(source.size());
        source.elements().forEachRemaining(elements::add);
        return elements;
    }

    private JsonNode sourceValue(JsonNode payload, ContractField field) {
        JsonNode exact = payload.get(field.sourceName());
        if (exact != null) {
            return exact;
        }
        Iterator<String> names = payload.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (name.equalsIgnoreCase(field.sourceName()) || name.equalsIgnoreCase(field.name())) {
                return payload.get(name);
            }
        }
        return null;
    }

    // Returns null for missing, null or blank values.
    private JsonNode normalize(ContractField field, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (!value.isTextual()) {
            return value;
        }
        String text = Normalizer.normalize(value.asText(), Normalizer.Form.NFC).strip();
        if (text.isEmpty()) {
            return null;
        }
        if (field.type() == FieldType.STRING) {
            text = WHITESPACE_RUN.matcher(text).replaceAll(" ");
            if (field.caseMode() == CaseMode.UPPER) {
                text = text.toUpperCase(Locale.ROOT);
            } else if (field.caseMode() == CaseMode.LOWER) {
                text = text.toLowerCase(Locale.ROOT);
            }
        }
        return TextNode.valueOf(text);
    }

    private RejectReason validate(ContractField field, Object value) {
        if (value == null) {
            return field.required() ? RejectReason.validation(field.name(), "required", null) : null;
        }
        if (value instanceof String text) {
            int maxLength = field.maxLength() == null ? FieldType.DEFAULT_STRING_LENGTH : field.maxLength();
            if (text.length() > maxLength) {
                return RejectReason.validation(field.name(), "max_length", text);
            }
        }
        if (value instanceof BigDecimal decimal
            && decimal.precision() - decimal.scale() > FieldType.DECIMAL_INTEGER_DIGITS) {
            return RejectReason.validation(field.name(), "precision", decimal.toPlainString());
        }
        if (value instanceof Long || value instanceof BigDecimal) {
            BigDecimal number = value instanceof Long longValue ? BigDecimal.valueOf(longValue) : (BigDecimal) value;
            if (field.min() != null && number.compareTo(field.min()) < 0) {
                return RejectReason.validation(field.name(), "min", number.toPlainString());
            }
            if (field.max() != null && number.compareTo(field.max()) > 0) {
                return RejectReason.validation(field.name(), "max", number.toPlainString());
            }
        }
        if (!field.allowedValues().isEmpty() && !field.allowedValues().contains(String.valueOf(value))) {
            return RejectReason.validation(field.name(), "allowed_values", String.valueOf(value));
        }
        return null;
    }

    private NaturalKey naturalKey(DataContract contract, Map<String, Object> values) {
        List<Object> keyValues = new ArrayList<>(contract.naturalKey().size());
        for (String keyField : contract.naturalKey()) {
            keyValues.add(values.get(keyField));
        }
        return new NaturalKey(keyValues);
    }
}

package com.transit.ingest.etl.contract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shape shared by every stage: the ordered fields of one target table and its natural key.
 */
public record DataContract(
    String name,
    String tableName,
    List<ContractField> fields,
    List<String> naturalKey
) {
    public DataContract {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Contract name is required");
        }
        if (tableName == null || !ContractField.IDENTIFIER.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        fields = List.copyOf(fields);
        naturalKey = List.copyOf(naturalKey);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Contract " + name + " has no fields");
        }
        if (naturalKey.isEmpty()) {
            throw new IllegalArgumentException("Contract " + name + " has no natural key");
        }
        Map<String, ContractField> byName = new LinkedHashMap<>();
        int explodedFields = 0;
        for (ContractField field : fields) {
            if (byName.put(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate field " + field.name() + " in " + name);
            }
            if (field.exploded()) {
                explodedFields++;
            }
        }
        if (explodedFields > 1) {
            throw new IllegalArgumentException("Contract " + name + " can explode at most one field");
        }
        for (String key : naturalKey) {
            ContractField field = byName.get(key);
            if (field == null) {
                throw new IllegalArgumentException("Natural key " + key + " is not a field of " + name);
            }
            if (!field.required()) {
                throw new IllegalArgumentException("Natural key " + key + " of " + name + " must be required");
            }
        }
    }

    public static Builder builder(String name, String tableName) {
        return new Builder(name, tableName);
    }

    public ContractField field(String fieldName) {
        for (ContractField field : fields) {
            if (field.name().equals(fieldName)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown field " + fieldName + " in contract " + name);
    }

    public Optional<ContractField> explodedField() {
        return fields.stream().filter(ContractField::exploded).findFirst();
    }

    public boolean isKey(String fieldName) {
        return naturalKey.contains(fieldName);
    }

    public List<ContractField> nonKeyFields() {
        List<ContractField> result = new ArrayList<>();
        for (ContractField field : fields) {
            if (!isKey(field.name())) {
                result.add(field);
            }
        }
        return result;
    }

    public String uniqueConstraintName() {
        return tableName + "_natural_key";
    }

    public static final class Builder {
        private final String name;
        private final String tableName;
        private final List<ContractField> fields = new ArrayList<>();
        private final List<String> naturalKey = new ArrayList<>();

        private Builder(String name, String tableName) {
            this.name = name;
            this.tableName = tableName;
        }

        public Builder field(ContractField.Builder field) {
            fields.add(field.build());
            return this;
        }

        public Builder naturalKey(String... keyFields) {
            naturalKey.addAll(List.of(keyFields));
            return this;
        }

        public DataContract build() {
            return new DataContract(name, tableName, fields, naturalKey);
        }
    }
}

package com.transit.ingest.etl.persistence;

import com.transit.ingest.etl.contract.ContractField;
import com.transit.ingest.etl.contract.DataContract;
import com.transit.ingest.etl.model.CleanRecord;
import com.transit.ingest.etl.model.UpsertOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Table-level operations for a {@link DataContract}. Identifiers are always quoted, so
 * column names that are SQL keywords still work.
 */
@Repository
public class ContractTableRepository {
    private static final Logger log = LoggerFactory.getLogger(ContractTableRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    public ContractTableRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public boolean tableExists(String tableName) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM information_schema.tables
                WHERE LOWER(table_name) = :tableName
                  AND LOWER(table_schema) = LOWER(CURRENT_SCHEMA)
                """,
            new MapSqlParameterSource().addValue("tableName", tableName.toLowerCase(Locale.ROOT)),
            Integer.class
        );
        return count != null && count > 0;
    }

    public Set<String> existingColumns(String tableName) {
        List<String> columns = jdbc.queryForList(
            """
                SELECT column_name
                FROM information_schema.columns
                WHERE LOWER(table_name) = :tableName
                  AND LOWER(table_schema) = LOWER(CURRENT_SCHEMA)
                """,
            new MapSqlParameterSource().addValue("tableName", tableName.toLowerCase(Locale.ROOT)),
            String.class
        );
        Set<String> result = new LinkedHashSet<>();
        for (String column : columns) {
            result.add(column.toLowerCase(Locale.ROOT));
        }
        return result;
    }

    public void createTable(DataContract contract) {
        String ddl = createTableSql(contract);
        jdbc.getJdbcTemplate().execute(ddl);
        log.info("Created table {} for contract {}", contract.tableName(), contract.name());
    }

    String createTableSql(DataContract contract) {
        List<String> definitions = new ArrayList<>();
        for (ContractField field : contract.fields()) {
            definitions.add(quote(field.name()) + " " + field.sqlType() + (field.required() ? " NOT NULL" : ""));
        }
        definitions.add(
            "CONSTRAINT " + quote(contract.uniqueConstraintName())
                + " UNIQUE (" + joinQuoted(contract.naturalKey()) + ")"
        );
        return "CREATE TABLE IF NOT EXISTS " + quote(contract.tableName())
            + " (\n    " + String.join(",\n    ", definitions) + "\n)";
    }

    /**
     * Inserts the record, or updates its row when a non-key column differs. Must run inside
     * the caller's transaction for batch atomicity.
     */
    public UpsertOutcome upsert(DataContract contract, CleanRecord record) {
        Map<String, Object> existing = findByKey(contract, record);
        if (existing == null) {
            insert(contract, record);
            return UpsertOutcome.INSERTED;
        }
        for (ContractField field : contract.nonKeyFields()) {
            if (!ColumnValues.sameValue(existing.get(field.name()), record.get(field.name()))) {
                update(contract, record);
                return UpsertOutcome.UPDATED;
            }
        }
        return UpsertOutcome.UNCHANGED;
    }

    public long countRows(DataContract contract) {
        Long count = jdbc.getJdbcTemplate().queryForObject(
            "SELECT COUNT(*) FROM " + quote(contract.tableName()),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private Map<String, Object> findByKey(DataContract contract, CleanRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT " + joinQuoted(fieldNames(contract.fields()))
            + " FROM " + quote(contract.tableName())
            + " WHERE " + keyPredicate(contract, record, params);
        List<Map<String, Object>> rows = jdbc.query(sql, params, (rs, rowNum) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            for (ContractField field : contract.fields()) {
                row.put(field.name(), ColumnValues.read(rs, field.name(), field.type()));
            }
            return row;
        });
        return rows.isEmpty() ? null : rows.get(0);
    }

    private void insert(DataContract contract, CleanRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> placeholders = new ArrayList<>();
        for (ContractField field : contract.fields()) {
            placeholders.add(bind(params, field, record));
        }
        jdbc.update(
            "INSERT INTO " + quote(contract.tableName())
                + " (" + joinQuoted(fieldNames(contract.fields())) + ")"
                + " VALUES (" + String.join(", ", placeholders) + ")",
            params
        );
    }

    private void update(DataContract contract, CleanRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> assignments = new ArrayList<>();
        for (ContractField field : contract.nonKeyFields()) {
            assignments.add(quote(field.name()) + " = " + bind(params, field, record));
        }
        jdbc.update(
            "UPDATE " + quote(contract.tableName())
                + " SET " + String.join(", ", assignments)
                + " WHERE " + keyPredicate(contract, record, params),
            params
        );
    }

    private String keyPredicate(DataContract contract, CleanRecord record, MapSqlParameterSource params) {
        List<String> conditions = new ArrayList<>();
        for (String key : contract.naturalKey()) {
            conditions.add(quote(key) + " = " + bind(params, contract.field(key), record));
        }
        return String.join(" AND ", conditions);
    }

    private String bind(MapSqlParameterSource params, ContractField field, CleanRecord record) {
        String name = "p" + params.getParameterNames().length;
        params.addValue(name, record.get(field.name()), ColumnValues.sqlType(field.type()));
        return ":" + name;
    }

    private static List<String> fieldNames(List<ContractField> fields) {
        return fields.stream().map(ContractField::name).collect(Collectors.toList());
    }

    private static String joinQuoted(List<String> identifiers) {
        return identifiers.stream().map(ContractTableRepository::quote).collect(Collectors.joining(", "));
    }

    static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }
}

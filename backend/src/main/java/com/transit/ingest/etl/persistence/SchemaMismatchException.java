package com.transit.ingest.etl.persistence;

import java.util.List;

/**
 * The target table exists but lacks columns the contract needs. Nothing has been written.
 */
public class SchemaMismatchException extends RuntimeException {
    private final String tableName;
    private final List<String> missingColumns;

    public SchemaMismatchException(String tableName, List<String> missingColumns) {
        super("Table " + tableName + " is missing contract columns " + missingColumns);
        this.tableName = tableName;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String tableName() {
        return tableName;
    }

    public List<String> missingColumns() {
        return missingColumns;
    }
}

package com.vcinsidedigital.oci_store.schema;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;

public enum ColumnType {
    INTEGER,
    TEXT,
    TIMESTAMP;

    public String sqlType(DatabaseConfig.DatabaseType dbType) {
        return switch (this) {
            case INTEGER -> "INTEGER";
            case TEXT -> "TEXT";
            case TIMESTAMP -> switch (dbType) {
                case SQLITE -> "DATETIME";
                case POSTGRESQL -> "TIMESTAMP";
            };
        };
    }
}

package com.vcinsidedigital.oci_store.schema;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the statement forms used by migrations. Every form is portable between SQLite and
 * PostgreSQL except for the column types, which go through {@link ColumnType#sqlType}.
 */
public final class SqlStatements {

    private SqlStatements() {
    }

    public static String createTable(TableDefinition table, DatabaseConfig.DatabaseType dbType) {
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
                .append(table.getName()).append(" (");

        List<String> parts = new ArrayList<>();
        for (ColumnDefinition column : table.getColumns()) {
            parts.add(columnDefinition(column, dbType));
        }
        for (ForeignKeyDefinition fk : table.getForeignKeys()) {
            parts.add(foreignKey(fk));
        }

        sql.append(String.join(", ", parts));
        sql.append(")");
        return sql.toString();
    }

    /**
     * Copies every row of {@code sourceTable} into {@code target} with the same explicit column
     * list on both sides, so the copy matches columns by name and never by position.
     */
    public static String copyRows(String sourceTable, TableDefinition target) {
        String columns = String.join(", ", target.columnNames());
        return "INSERT INTO " + target.getName() + " (" + columns + ") "
                + "SELECT " + columns + " FROM " + sourceTable;
    }

    public static String dropTable(String tableName, boolean ifExists) {
        return ifExists
                ? "DROP TABLE IF EXISTS " + tableName
                : "DROP TABLE " + tableName;
    }

    public static String renameTable(String from, String to) {
        return "ALTER TABLE " + from + " RENAME TO " + to;
    }

    public static String createIndex(IndexDefinition index) {
        return "CREATE " + (index.isUnique() ? "UNIQUE " : "") + "INDEX IF NOT EXISTS "
                + index.getName() + " ON " + index.getTable()
                + "(" + String.join(", ", index.getColumns()) + ")";
    }

    private static String columnDefinition(ColumnDefinition column, DatabaseConfig.DatabaseType dbType) {
        StringBuilder def = new StringBuilder(column.getName())
                .append(" ").append(column.getType().sqlType(dbType));

        if (column.isPrimaryKey()) {
            def.append(" PRIMARY KEY");
        } else if (!column.isNullable()) {
            def.append(" NOT NULL");
        }
        if (column.isUnique()) {
            def.append(" UNIQUE");
        }
        if (column.getDefaultExpression() != null) {
            def.append(" DEFAULT ").append(column.getDefaultExpression());
        }
        return def.toString();
    }

    private static String foreignKey(ForeignKeyDefinition fk) {
        String sql = String.format("FOREIGN KEY (%s) REFERENCES %s(%s)",
                fk.getColumn(), fk.getReferencedTable(), fk.getReferencedColumn());
        if (fk.getOnDelete() != ForeignKeyAction.NO_ACTION) {
            sql += " ON DELETE " + fk.getOnDelete().sql();
        }
        return sql;
    }
}

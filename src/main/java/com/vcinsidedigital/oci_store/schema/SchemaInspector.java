package com.vcinsidedigital.oci_store.schema;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the live schema through one connection. Queries run inside whatever transaction the
 * connection currently has open, so a migration sees its own uncommitted DDL.
 */
public class SchemaInspector {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Connection connection;
    private final DatabaseConfig.DatabaseType dbType;

    public SchemaInspector(Connection connection, DatabaseConfig.DatabaseType dbType) {
        this.connection = connection;
        this.dbType = dbType;
    }

    public boolean tableExists(String tableName) throws SQLException {
        String sql = switch (dbType) {
            case SQLITE -> "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?";
            case POSTGRESQL -> "SELECT table_name FROM information_schema.tables "
                    + "WHERE table_schema = current_schema() AND table_name = ?";
        };
        return exists(sql, tableName);
    }

    public boolean indexExists(String indexName) throws SQLException {
        String sql = switch (dbType) {
            case SQLITE -> "SELECT name FROM sqlite_master WHERE type = 'index' AND name = ?";
            case POSTGRESQL -> "SELECT indexname FROM pg_indexes "
                    + "WHERE schemaname = current_schema() AND indexname = ?";
        };
        return exists(sql, indexName);
    }

    /**
     * Column names in declaration order, empty when the table does not exist.
     */
    public List<String> columnNames(String tableName) throws SQLException {
        List<String> columns = new ArrayList<>();

        switch (dbType) {
            case SQLITE -> {
                try (Statement stmt = connection.createStatement();
                     ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + requireIdentifier(tableName) + ")")) {
                    while (rs.next()) {
                        columns.add(rs.getString("name"));
                    }
                }
            }
            case POSTGRESQL -> {
                String sql = "SELECT column_name FROM information_schema.columns "
                        + "WHERE table_schema = current_schema() AND table_name = ? "
                        + "ORDER BY ordinal_position";
                try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
                    pstmt.setString(1, tableName);
                    try (ResultSet rs = pstmt.executeQuery()) {
                        while (rs.next()) {
                            columns.add(rs.getString("column_name"));
                        }
                    }
                }
            }
        }

        return columns;
    }

    /**
     * Columns covered by an index, in key order.
     */
    public List<String> indexedColumns(String indexName) throws SQLException {
        List<String> columns = new ArrayList<>();

        switch (dbType) {
            case SQLITE -> {
                try (Statement stmt = connection.createStatement();
                     ResultSet rs = stmt.executeQuery("PRAGMA index_info(" + requireIdentifier(indexName) + ")")) {
                    // rows come back ordered by seqno
                    while (rs.next()) {
                        columns.add(rs.getString("name"));
                    }
                }
            }
            case POSTGRESQL -> {
                String sql = "SELECT a.attname FROM pg_index ix "
                        + "JOIN pg_class i ON i.oid = ix.indexrelid "
                        + "JOIN pg_namespace n ON n.oid = i.relnamespace "
                        + "JOIN LATERAL unnest(ix.indkey) WITH ORDINALITY AS k(attnum, ord) ON true "
                        + "JOIN pg_attribute a ON a.attrelid = ix.indrelid AND a.attnum = k.attnum "
                        + "WHERE i.relname = ? AND n.nspname = current_schema() "
                        + "ORDER BY k.ord";
                try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
                    pstmt.setString(1, indexName);
                    try (ResultSet rs = pstmt.executeQuery()) {
                        while (rs.next()) {
                            columns.add(rs.getString("attname"));
                        }
                    }
                }
            }
        }

        return columns;
    }

    public List<ForeignKeyDefinition> foreignKeys(String tableName) throws SQLException {
        List<ForeignKeyDefinition> foreignKeys = new ArrayList<>();

        switch (dbType) {
            case SQLITE -> {
                try (Statement stmt = connection.createStatement();
                     ResultSet rs = stmt.executeQuery("PRAGMA foreign_key_list(" + requireIdentifier(tableName) + ")")) {
                    while (rs.next()) {
                        foreignKeys.add(new ForeignKeyDefinition(
                                rs.getString("from"),
                                rs.getString("table"),
                                rs.getString("to"),
                                ForeignKeyAction.fromSql(rs.getString("on_delete"))));
                    }
                }
            }
            case POSTGRESQL -> {
                String sql = "SELECT kcu.column_name, ccu.table_name AS ref_table, "
                        + "ccu.column_name AS ref_column, rc.delete_rule "
                        + "FROM information_schema.table_constraints tc "
                        + "JOIN information_schema.key_column_usage kcu "
                        + "ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema "
                        + "JOIN information_schema.referential_constraints rc "
                        + "ON rc.constraint_name = tc.constraint_name AND rc.constraint_schema = tc.table_schema "
                        + "JOIN information_schema.constraint_column_usage ccu "
                        + "ON ccu.constraint_name = tc.constraint_name AND ccu.constraint_schema = tc.table_schema "
                        + "WHERE tc.constraint_type = 'FOREIGN KEY' "
                        + "AND tc.table_schema = current_schema() AND tc.table_name = ? "
                        + "ORDER BY kcu.ordinal_position";
                try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
                    pstmt.setString(1, tableName);
                    try (ResultSet rs = pstmt.executeQuery()) {
                        while (rs.next()) {
                            foreignKeys.add(new ForeignKeyDefinition(
                                    rs.getString("column_name"),
                                    rs.getString("ref_table"),
                                    rs.getString("ref_column"),
                                    ForeignKeyAction.fromSql(rs.getString("delete_rule"))));
                        }
                    }
                }
            }
        }

        return foreignKeys;
    }

    private boolean exists(String sql, String name) throws SQLException {
        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setString(1, name);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a plain SQL identifier: " + name);
        }
        return name;
    }
}

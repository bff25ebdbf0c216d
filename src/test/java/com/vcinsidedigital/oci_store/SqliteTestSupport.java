package com.vcinsidedigital.oci_store;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for tests that run against a SQLite file in a temporary directory.
 */
public final class SqliteTestSupport {

    private SqliteTestSupport() {
    }

    public static DatabaseConfig config(Path dir) {
        return DatabaseConfig.builder()
                .sqlite(dir.resolve("oci.db").toString())
                .poolSize(3, 1)
                .connectionTimeout(5000)
                .build();
    }

    /**
     * A connection outside any pool, with foreign keys enforced like the pool's.
     */
    public static Connection connect(DatabaseConfig config) throws SQLException {
        return DriverManager.getConnection(config.getJdbcUrl(), config.getConnectionProperties());
    }

    /**
     * A connection with foreign key enforcement off, for planting inconsistent data.
     */
    public static Connection connectWithoutForeignKeys(DatabaseConfig config) throws SQLException {
        return DriverManager.getConnection(config.getJdbcUrl());
    }

    public static void execute(Connection conn, String... statements) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }

    public static long count(Connection conn, String table) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * Every row of a table keyed by {@code id}, each row as column name to string value.
     */
    public static Map<Long, Map<String, String>> rowsById(Connection conn, String table) throws SQLException {
        Map<Long, Map<String, String>> rows = new LinkedHashMap<>();
        try (PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM " + table + " ORDER BY id");
             ResultSet rs = pstmt.executeQuery()) {
            int columnCount = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    row.put(rs.getMetaData().getColumnName(i), rs.getString(i));
                }
                rows.put(rs.getLong("id"), row);
            }
        }
        return rows;
    }

    public static List<String> queryPlan(Connection conn, String query) throws SQLException {
        List<String> details = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("EXPLAIN QUERY PLAN " + query)) {
            while (rs.next()) {
                details.add(rs.getString("detail"));
            }
        }
        return details;
    }
}

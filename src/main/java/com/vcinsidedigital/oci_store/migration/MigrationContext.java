package com.vcinsidedigital.oci_store.migration;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.schema.SchemaInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class MigrationContext {
    private static final Logger logger = LoggerFactory.getLogger(MigrationContext.class);

    private final Connection connection;
    private final DatabaseConfig.DatabaseType dbType;
    private final SchemaInspector inspector;

    public MigrationContext(Connection connection, DatabaseConfig.DatabaseType dbType) {
        this.connection = connection;
        this.dbType = dbType;
        this.inspector = new SchemaInspector(connection, dbType);
    }

    public void execute(String sql) throws SQLException {
        logger.debug("SQL: {}", sql);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            logger.error("✗ Failed to execute: {} - Error: {}", sql, e.getMessage());
            throw e;
        }
    }

    public Connection getConnection() {
        return connection;
    }

    public DatabaseConfig.DatabaseType getDatabaseType() {
        return dbType;
    }

    public SchemaInspector getInspector() {
        return inspector;
    }
}

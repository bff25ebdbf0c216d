package com.vcinsidedigital.oci_store;

import com.vcinsidedigital.oci_store.config.ConnectionPool;
import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.migration.Migration;
import com.vcinsidedigital.oci_store.migration.MigrationException;
import com.vcinsidedigital.oci_store.migration.MigrationManager;
import com.vcinsidedigital.oci_store.migration.MigrationStatus;
import migrations.Migrations;

import java.util.List;

/**
 * Entry point for bringing an OCI store database to the current schema.
 */
public class OciStoreDatabase implements AutoCloseable {
    private final DatabaseConfig config;
    private final ConnectionPool pool;
    private final MigrationManager migrationManager;

    public OciStoreDatabase(DatabaseConfig config) {
        this(config, Migrations.all());
    }

    public OciStoreDatabase(DatabaseConfig config, List<? extends Migration> migrations) {
        this.config = config;
        this.pool = ConnectionPool.initialize(config);
        this.migrationManager = new MigrationManager(pool);
        for (Migration migration : migrations) {
            migrationManager.addMigration(migration);
        }
    }

    /**
     * Applies every pending migration, each in its own transaction.
     *
     * @return the versions applied by this call
     */
    public List<String> migrate() throws MigrationException {
        return migrationManager.migrate();
    }

    public List<MigrationStatus> status() throws MigrationException {
        return migrationManager.status();
    }

    public DatabaseConfig getConfig() {
        return config;
    }

    public ConnectionPool getConnectionPool() {
        return pool;
    }

    public MigrationManager getMigrationManager() {
        return migrationManager;
    }

    public void shutdown() {
        pool.close();
    }

    @Override
    public void close() {
        shutdown();
    }
}

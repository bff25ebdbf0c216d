package com.vcinsidedigital.oci_store.migration;

import com.vcinsidedigital.oci_store.config.ConnectionPool;
import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.*;

/**
 * Applies registered migrations in version order, one transaction per migration, and records
 * each applied version in {@code schema_migrations}.
 * <p>
 * The manager assumes it is the only writer of the affected tables while it runs.
 */
public class MigrationManager {
    private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);

    static final String LEDGER_TABLE = "schema_migrations";

    private final ConnectionPool pool;
    private final DatabaseConfig.DatabaseType dbType;
    private final List<Migration> migrations = new ArrayList<>();

    public MigrationManager() {
        this(ConnectionPool.getInstance());
    }

    public MigrationManager(ConnectionPool pool) {
        this.pool = pool;
        this.dbType = pool.getConfig().getType();
    }

    public MigrationManager addMigration(Migration migration) {
        boolean duplicate = migrations.stream()
                .anyMatch(m -> m.getVersion().equals(migration.getVersion()));
        if (duplicate) {
            throw new IllegalArgumentException("Migration version registered twice: " + migration.getVersion());
        }
        migrations.add(migration);
        migrations.sort(Comparator.comparing(Migration::getVersion));
        return this;
    }

    public List<Migration> getMigrations() {
        return Collections.unmodifiableList(migrations);
    }

    /**
     * Applies every pending migration.
     *
     * @return versions applied by this call, empty when the schema was already current
     * @throws MigrationException if a checksum no longer matches or a migration fails; the failed
     *                            migration is rolled back, earlier ones in this call stay committed
     */
    public List<String> migrate() throws MigrationException {
        Map<String, AppliedMigration> applied;
        try {
            ensureMigrationTable();
            applied = getAppliedMigrations();
        } catch (SQLException e) {
            throw new MigrationException("Could not read " + LEDGER_TABLE + ": " + e.getMessage(), e);
        }

        verifyApplied(applied);

        List<String> appliedNow = new ArrayList<>();
        for (Migration migration : migrations) {
            if (!applied.containsKey(migration.getVersion())) {
                logger.info("Applying migration: {}", migration);
                applyMigration(migration);
                logger.info("Migration {} applied successfully", migration.getVersion());
                appliedNow.add(migration.getVersion());
            }
        }

        if (appliedNow.isEmpty()) {
            logger.info("Schema is up to date ({} migrations applied)", applied.size());
        }
        return appliedNow;
    }

    public List<Migration> pending() throws MigrationException {
        Map<String, AppliedMigration> applied = readLedger();
        return migrations.stream()
                .filter(m -> !applied.containsKey(m.getVersion()))
                .toList();
    }

    public List<MigrationStatus> status() throws MigrationException {
        Map<String, AppliedMigration> applied = readLedger();
        List<MigrationStatus> statuses = new ArrayList<>();
        for (Migration migration : migrations) {
            AppliedMigration row = applied.get(migration.getVersion());
            statuses.add(new MigrationStatus(
                    migration.getVersion(),
                    migration.getDescription(),
                    row != null,
                    row != null ? row.appliedAt : null));
        }
        return statuses;
    }

    private Map<String, AppliedMigration> readLedger() throws MigrationException {
        try {
            ensureMigrationTable();
            return getAppliedMigrations();
        } catch (SQLException e) {
            throw new MigrationException("Could not read " + LEDGER_TABLE + ": " + e.getMessage(), e);
        }
    }

    private void verifyApplied(Map<String, AppliedMigration> applied) throws MigrationException {
        Set<String> known = new HashSet<>();
        for (Migration migration : migrations) {
            known.add(migration.getVersion());
            AppliedMigration row = applied.get(migration.getVersion());
            if (row == null) {
                continue;
            }

            String expected;
            try {
                expected = migration.checksum(dbType);
            } catch (RuntimeException e) {
                throw new MigrationException(migration.getVersion(),
                        "Invalid step plan for " + migration + ": " + e.getMessage(), e);
            }
            if (expected != null && row.checksum != null && !expected.equals(row.checksum)) {
                throw new MigrationException(migration.getVersion(),
                        "Checksum mismatch for applied migration " + migration.getVersion()
                                + ": recorded " + row.checksum + ", found " + expected, null);
            }
        }

        for (String version : applied.keySet()) {
            if (!known.contains(version)) {
                logger.warn("Applied migration {} is not registered with this manager", version);
            }
        }
    }

    private void ensureMigrationTable() throws SQLException {
        try (ConnectionPool.Lease lease = pool.acquire();
             Statement stmt = lease.connection().createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_migrations (
                    version VARCHAR(255) PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    checksum VARCHAR(64),
                    applied_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )
                """);
        }
    }

    private Map<String, AppliedMigration> getAppliedMigrations() throws SQLException {
        Map<String, AppliedMigration> versions = new HashMap<>();
        try (ConnectionPool.Lease lease = pool.acquire();
             Statement stmt = lease.connection().createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT version, checksum, applied_at FROM schema_migrations")) {
            while (rs.next()) {
                versions.put(rs.getString("version"),
                        new AppliedMigration(rs.getString("checksum"), rs.getString("applied_at")));
            }
        }
        return versions;
    }

    private void applyMigration(Migration migration) throws MigrationException {
        try (ConnectionPool.Lease lease = pool.acquire()) {
            Connection conn = lease.connection();
            // closing the lease restores auto-commit
            conn.setAutoCommit(false);
            try {
                MigrationContext context = new MigrationContext(conn, dbType);
                migration.up(context);

                String sql = "INSERT INTO schema_migrations (version, description, checksum) VALUES (?, ?, ?)";
                try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                    pstmt.setString(1, migration.getVersion());
                    pstmt.setString(2, migration.getDescription());
                    pstmt.setString(3, migration.checksum(dbType));
                    pstmt.executeUpdate();
                }

                conn.commit();
            } catch (Exception e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                logger.error("Migration {} failed and was rolled back", migration.getVersion());
                throw new MigrationException(migration.getVersion(),
                        "Migration " + migration + " failed: " + e.getMessage(), e);
            }
        } catch (SQLException e) {
            throw new MigrationException(migration.getVersion(),
                    "Migration " + migration + " could not run: " + e.getMessage(), e);
        }
    }

    private static final class AppliedMigration {
        final String checksum;
        final String appliedAt;

        AppliedMigration(String checksum, String appliedAt) {
            this.checksum = checksum;
            this.appliedAt = appliedAt;
        }
    }
}

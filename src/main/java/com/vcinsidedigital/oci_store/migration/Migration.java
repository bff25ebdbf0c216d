package com.vcinsidedigital.oci_store.migration;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;

/**
 * One versioned, forward-only schema change. The runner applies {@link #up} inside a
 * transaction it owns; implementations must not commit or roll back themselves.
 */
public abstract class Migration {
    private final String version;
    private final String description;

    protected Migration(String version, String description) {
        if (version == null || !version.matches("\\d{14}")) {
            throw new IllegalArgumentException("Migration version must be a 14-digit timestamp: " + version);
        }
        this.version = version;
        this.description = description;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public abstract void up(MigrationContext context) throws Exception;

    /**
     * Fingerprint of what {@link #up} runs against the given database type, or {@code null} when the
     * migration can't describe itself up front. Recorded on apply and verified on later runs.
     */
    public String checksum(DatabaseConfig.DatabaseType dbType) {
        return null;
    }

    @Override
    public String toString() {
        return version + " " + description;
    }
}

package com.vcinsidedigital.oci_store.migration;

/**
 * Raised by {@link MigrationManager} when the schema could not be brought forward. Whatever
 * migration failed has been rolled back in full by the time this is thrown.
 */
public class MigrationException extends Exception {
    private final String version;

    public MigrationException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public MigrationException(String version, String message, Throwable cause) {
        super(message, cause);
        this.version = version;
    }

    /**
     * Version of the offending migration, {@code null} if the failure was not tied to one.
     */
    public String getVersion() {
        return version;
    }
}

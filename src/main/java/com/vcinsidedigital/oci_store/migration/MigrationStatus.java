package com.vcinsidedigital.oci_store.migration;

public class MigrationStatus {
    private final String version;
    private final String description;
    private final boolean applied;
    private final String appliedAt;

    public MigrationStatus(String version, String description, boolean applied, String appliedAt) {
        this.version = version;
        this.description = description;
        this.applied = applied;
        this.appliedAt = appliedAt;
    }

    public String getVersion() { return version; }
    public String getDescription() { return description; }
    public boolean isApplied() { return applied; }
    public String getAppliedAt() { return appliedAt; }

    @Override
    public String toString() {
        return version + " " + description + (applied ? " [applied " + appliedAt + "]" : " [pending]");
    }
}

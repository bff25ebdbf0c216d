package com.vcinsidedigital.oci_store.migration;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.migration.step.MigrationStep;
import com.vcinsidedigital.oci_store.migration.step.StepPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * A migration described as a set of {@link MigrationStep}s instead of raw statements.
 * Steps run in dependency order; the checksum covers the SQL of every step.
 */
public abstract class StepMigration extends Migration {
    private static final Logger logger = LoggerFactory.getLogger(StepMigration.class);

    protected StepMigration(String version, String description) {
        super(version, description);
    }

    protected abstract List<MigrationStep> steps();

    public List<MigrationStep> plan() {
        return StepPlanner.order(steps());
    }

    @Override
    public void up(MigrationContext context) throws Exception {
        for (MigrationStep step : plan()) {
            logger.info("[{}] {}", getVersion(), step.id());
            step.apply(context);
        }
    }

    @Override
    public String checksum(DatabaseConfig.DatabaseType dbType) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (MigrationStep step : plan()) {
                for (String sql : step.statements(dbType)) {
                    digest.update(sql.getBytes(StandardCharsets.UTF_8));
                    digest.update((byte) '\n');
                }
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.vcinsidedigital.oci_store.migration.step;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.migration.MigrationContext;

import java.sql.SQLException;
import java.util.List;

/**
 * A single declarative unit of a migration. Steps name the steps they must follow instead of
 * relying on their position in a list; {@link StepPlanner} turns that into an execution order.
 */
public interface MigrationStep {

    String id();

    List<String> dependsOn();

    /**
     * The statements this step runs, in order.
     */
    List<String> statements(DatabaseConfig.DatabaseType dbType);

    default void apply(MigrationContext context) throws SQLException {
        for (String sql : statements(context.getDatabaseType())) {
            context.execute(sql);
        }
    }
}

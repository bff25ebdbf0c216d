package com.vcinsidedigital.oci_store.migration.step;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.schema.SqlStatements;

import java.util.List;

/**
 * Retires a table. Must be declared {@link #after} every step that removes references to it,
 * otherwise engines that check referential integrity on drop will refuse it.
 */
public class DropTableStep extends AbstractStep<DropTableStep> {
    private final String tableName;

    public DropTableStep(String tableName) {
        super("drop-table:" + tableName);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public List<String> statements(DatabaseConfig.DatabaseType dbType) {
        return List.of(SqlStatements.dropTable(tableName, true));
    }
}

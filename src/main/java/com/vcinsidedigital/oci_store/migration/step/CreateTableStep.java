package com.vcinsidedigital.oci_store.migration.step;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.schema.SqlStatements;
import com.vcinsidedigital.oci_store.schema.TableDefinition;

import java.util.List;

public class CreateTableStep extends AbstractStep<CreateTableStep> {
    private final TableDefinition table;

    public CreateTableStep(TableDefinition table) {
        super("create-table:" + table.getName());
        this.table = table;
    }

    public TableDefinition getTable() {
        return table;
    }

    @Override
    public List<String> statements(DatabaseConfig.DatabaseType dbType) {
        return List.of(SqlStatements.createTable(table, dbType));
    }
}

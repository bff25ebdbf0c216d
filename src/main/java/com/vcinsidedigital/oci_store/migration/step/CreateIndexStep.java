package com.vcinsidedigital.oci_store.migration.step;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.schema.IndexDefinition;
import com.vcinsidedigital.oci_store.schema.SqlStatements;

import java.util.List;

/**
 * Creates a secondary index if it is not there yet. Table rebuilds lose their indexes, so a
 * rebuild is normally followed by one of these per index.
 */
public class CreateIndexStep extends AbstractStep<CreateIndexStep> {
    private final IndexDefinition index;

    public CreateIndexStep(IndexDefinition index) {
        super("create-index:" + index.getName());
        this.index = index;
    }

    public IndexDefinition getIndex() {
        return index;
    }

    @Override
    public List<String> statements(DatabaseConfig.DatabaseType dbType) {
        return List.of(SqlStatements.createIndex(index));
    }
}

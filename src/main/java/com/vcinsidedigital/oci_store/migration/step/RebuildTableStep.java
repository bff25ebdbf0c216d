package com.vcinsidedigital.oci_store.migration.step;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.migration.MigrationContext;
import com.vcinsidedigital.oci_store.schema.SchemaInspector;
import com.vcinsidedigital.oci_store.schema.SqlStatements;
import com.vcinsidedigital.oci_store.schema.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;

/**
 * Rebuilds a table into a new shape through a shadow table: create {@code <table>_new}, copy
 * the rows, drop the original and rename the shadow into its place.
 * <p>
 * This is how a column gets dropped on engines that can't drop a column with a foreign key.
 * Columns of the old table missing from the target are discarded with their values. Indexes of the
 * old table go away with it and have to be recreated afterwards. The four statements are only safe
 * inside one transaction: between the drop and the rename the table name does not exist.
 */
public class RebuildTableStep extends AbstractStep<RebuildTableStep> {
    private static final Logger logger = LoggerFactory.getLogger(RebuildTableStep.class);

    private final TableDefinition target;
    private final TableDefinition shadow;

    public RebuildTableStep(TableDefinition target) {
        super("rebuild-table:" + target.getName());
        this.target = target;
        this.shadow = target.renamedTo(target.getName() + "_new");
    }

    public TableDefinition getTarget() {
        return target;
    }

    public String getShadowName() {
        return shadow.getName();
    }

    @Override
    public List<String> statements(DatabaseConfig.DatabaseType dbType) {
        return List.of(
                SqlStatements.createTable(shadow, dbType),
                SqlStatements.copyRows(target.getName(), shadow),
                SqlStatements.dropTable(target.getName(), false),
                SqlStatements.renameTable(shadow.getName(), target.getName()));
    }

    @Override
    public void apply(MigrationContext context) throws SQLException {
        SchemaInspector inspector = context.getInspector();
        String tableName = target.getName();

        if (!inspector.tableExists(tableName)) {
            throw new IllegalStateException("Cannot rebuild table '" + tableName + "': it does not exist");
        }

        List<String> existing = inspector.columnNames(tableName);
        List<String> missing = target.columnNames().stream()
                .filter(column -> !existing.contains(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Cannot rebuild table '" + tableName + "': source is missing columns " + missing);
        }

        List<String> dropped = existing.stream()
                .filter(column -> !target.hasColumn(column))
                .toList();
        if (!dropped.isEmpty()) {
            logger.info("Rebuilding '{}' drops columns {}", tableName, dropped);
        }

        super.apply(context);
        logger.info("✓ Table '{}' rebuilt with columns {}", tableName, target.columnNames());
    }
}

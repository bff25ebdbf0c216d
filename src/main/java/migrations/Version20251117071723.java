package migrations;

import com.vcinsidedigital.oci_store.migration.StepMigration;
import com.vcinsidedigital.oci_store.migration.step.CreateIndexStep;
import com.vcinsidedigital.oci_store.migration.step.DropTableStep;
import com.vcinsidedigital.oci_store.migration.step.MigrationStep;
import com.vcinsidedigital.oci_store.migration.step.RebuildTableStep;
import com.vcinsidedigital.oci_store.schema.IndexDefinition;
import com.vcinsidedigital.oci_store.schema.TableDefinition;

import java.util.List;

import static com.vcinsidedigital.oci_store.schema.ColumnDefinition.*;
import static com.vcinsidedigital.oci_store.schema.ColumnType.*;
import static com.vcinsidedigital.oci_store.schema.ForeignKeyAction.CASCADE;

/**
 * Images are now pulled from any registry without going through an image index. Manifests lose
 * their {@code index_id} column and the {@code indexes} table is retired.
 * <p>
 * The manifests table is rebuilt rather than altered because the column carries a foreign key.
 */
public class Version20251117071723 extends StepMigration {

    static final TableDefinition MANIFESTS = TableDefinition.builder("manifests")
            .column(primaryKey("id", INTEGER))
            .column(required("image_id", INTEGER))
            .column(required("schema_version", INTEGER))
            .column(required("media_type", TEXT))
            .column(optional("annotations_json", TEXT))
            .column(withDefault("created_at", TIMESTAMP, "CURRENT_TIMESTAMP"))
            .column(withDefault("modified_at", TIMESTAMP, "CURRENT_TIMESTAMP"))
            .foreignKey("image_id", "images", "id", CASCADE)
            .build();

    public Version20251117071723() {
        super("20251117071723", "pull from any registry changes");
    }

    @Override
    protected List<MigrationStep> steps() {
        RebuildTableStep rebuildManifests = new RebuildTableStep(MANIFESTS);

        return List.of(
                rebuildManifests,
                new CreateIndexStep(IndexDefinition.on("idx_manifests_image_id", "manifests", "image_id"))
                        .after(rebuildManifests),
                // manifests.index_id references indexes, so the rebuild has to come first
                new DropTableStep("indexes").after(rebuildManifests));
    }
}

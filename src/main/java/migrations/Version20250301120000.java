package migrations;

import com.vcinsidedigital.oci_store.migration.StepMigration;
import com.vcinsidedigital.oci_store.migration.step.CreateIndexStep;
import com.vcinsidedigital.oci_store.migration.step.CreateTableStep;
import com.vcinsidedigital.oci_store.migration.step.MigrationStep;
import com.vcinsidedigital.oci_store.schema.IndexDefinition;
import com.vcinsidedigital.oci_store.schema.TableDefinition;

import java.util.List;

import static com.vcinsidedigital.oci_store.schema.ColumnDefinition.*;
import static com.vcinsidedigital.oci_store.schema.ColumnType.*;
import static com.vcinsidedigital.oci_store.schema.ForeignKeyAction.CASCADE;
import static com.vcinsidedigital.oci_store.schema.ForeignKeyAction.NO_ACTION;

/**
 * Initial OCI store schema: images, their image indexes, and manifests that point at both.
 */
public class Version20250301120000 extends StepMigration {

    static final TableDefinition IMAGES = TableDefinition.builder("images")
            .column(primaryKey("id", INTEGER))
            .column(required("reference", TEXT).unique())
            .column(required("size_bytes", INTEGER))
            .column(optional("last_used_at", TIMESTAMP))
            .column(withDefault("created_at", TIMESTAMP, "CURRENT_TIMESTAMP"))
            .column(withDefault("modified_at", TIMESTAMP, "CURRENT_TIMESTAMP"))
            .build();

    static final TableDefinition INDEXES = TableDefinition.builder("indexes")
            .column(primaryKey("id", INTEGER))
            .column(required("image_id", INTEGER))
            .column(required("schema_version", INTEGER))
            .column(required("media_type", TEXT))
            .column(optional("platform_os", TEXT))
            .column(optional("platform_arch", TEXT))
            .column(optional("platform_variant", TEXT))
            .column(optional("annotations_json", TEXT))
            .column(withDefault("created_at", TIMESTAMP, "CURRENT_TIMESTAMP"))
            .column(withDefault("modified_at", TIMESTAMP, "CURRENT_TIMESTAMP"))
            .foreignKey("image_id", "images", "id", CASCADE)
            .build();

    static final TableDefinition MANIFESTS = TableDefinition.builder("manifests")
            .column(primaryKey("id", INTEGER))
            .column(optional("index_id", INTEGER))
            .column(required("image_id", INTEGER))
            .column(required("schema_version", INTEGER))
            .column(required("media_type", TEXT))
            .column(optional("annotations_json", TEXT))
            .column(withDefault("created_at", TIMESTAMP, "CURRENT_TIMESTAMP"))
            .column(withDefault("modified_at", TIMESTAMP, "CURRENT_TIMESTAMP"))
            .foreignKey("index_id", "indexes", "id", NO_ACTION)
            .foreignKey("image_id", "images", "id", CASCADE)
            .build();

    public Version20250301120000() {
        super("20250301120000", "create oci schema");
    }

    @Override
    protected List<MigrationStep> steps() {
        CreateTableStep images = new CreateTableStep(IMAGES);
        CreateTableStep indexes = new CreateTableStep(INDEXES).after(images);
        CreateTableStep manifests = new CreateTableStep(MANIFESTS).after(images, indexes);

        return List.of(
                images,
                indexes,
                manifests,
                new CreateIndexStep(IndexDefinition.on("idx_indexes_image_id", "indexes", "image_id"))
                        .after(indexes),
                new CreateIndexStep(IndexDefinition.on("idx_manifests_index_id", "manifests", "index_id"))
                        .after(manifests),
                new CreateIndexStep(IndexDefinition.on("idx_manifests_image_id", "manifests", "image_id"))
                        .after(manifests));
    }
}

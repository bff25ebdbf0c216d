package migrations;

import com.vcinsidedigital.oci_store.SqliteTestSupport;
import com.vcinsidedigital.oci_store.config.ConnectionPool;
import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.migration.Migration;
import com.vcinsidedigital.oci_store.migration.MigrationContext;
import com.vcinsidedigital.oci_store.migration.MigrationException;
import com.vcinsidedigital.oci_store.migration.MigrationManager;
import com.vcinsidedigital.oci_store.migration.step.MigrationStep;
import com.vcinsidedigital.oci_store.schema.ForeignKeyAction;
import com.vcinsidedigital.oci_store.schema.ForeignKeyDefinition;
import com.vcinsidedigital.oci_store.schema.SchemaInspector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("20251117071723 pull from any registry changes")
class Version20251117071723Test {

    private static final String OCI_MANIFEST = "application/vnd.oci.image.manifest.v1+json";

    @TempDir
    Path tempDir;

    private DatabaseConfig config;
    private ConnectionPool pool;

    @BeforeEach
    void setUp() throws Exception {
        config = SqliteTestSupport.config(tempDir);
        pool = new ConnectionPool(config);
        new MigrationManager(pool).addMigration(new Version20250301120000()).migrate();
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private MigrationManager fullManager() {
        MigrationManager manager = new MigrationManager(pool);
        Migrations.all().forEach(manager::addMigration);
        return manager;
    }

    private void seed() throws SQLException {
        try (Connection conn = SqliteTestSupport.connect(config)) {
            SqliteTestSupport.execute(conn,
                    "INSERT INTO images (id, reference, size_bytes) VALUES (7, 'docker.io/library/alpine:3.20', 3500000)",
                    "INSERT INTO images (id, reference, size_bytes) VALUES (8, 'ghcr.io/acme/tool:1.2', 12000000)",
                    "INSERT INTO indexes (id, image_id, schema_version, media_type) "
                            + "VALUES (99, 7, 2, 'application/vnd.oci.image.index.v1+json')",
                    "INSERT INTO manifests (id, index_id, image_id, schema_version, media_type, annotations_json, "
                            + "created_at, modified_at) VALUES "
                            + "(1, 99, 7, 2, '" + OCI_MANIFEST + "', NULL, '2025-03-01 10:00:00', '2025-03-01 10:00:00')",
                    "INSERT INTO manifests (id, index_id, image_id, schema_version, media_type, annotations_json, "
                            + "created_at, modified_at) VALUES "
                            + "(2, NULL, 8, 2, '" + OCI_MANIFEST + "', '{\"org.opencontainers.image.title\":\"tool\"}', "
                            + "'2025-04-02 11:30:00', '2025-05-06 08:15:00')",
                    "INSERT INTO manifests (id, index_id, image_id, schema_version, media_type) "
                            + "VALUES (3, 99, 7, 1, 'application/vnd.docker.distribution.manifest.v2+json')");
        }
    }

    @Nested
    @DisplayName("after migrating")
    class AfterMigrating {

        private Map<Long, Map<String, String>> before;

        @BeforeEach
        void migrate() throws Exception {
            seed();
            try (Connection conn = SqliteTestSupport.connect(config)) {
                before = SqliteTestSupport.rowsById(conn, "manifests");
            }
            assertThat(fullManager().migrate()).containsExactly("20251117071723");
        }

        @Test
        @DisplayName("keeps every manifest row")
        void rowCountPreserved() throws SQLException {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                assertThat(SqliteTestSupport.count(conn, "manifests")).isEqualTo(before.size()).isEqualTo(3);
            }
        }

        @Test
        @DisplayName("keeps every retained column value, nulls and timestamps included")
        void columnValuesPreserved() throws SQLException {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                Map<Long, Map<String, String>> after = SqliteTestSupport.rowsById(conn, "manifests");

                assertThat(after.keySet()).isEqualTo(before.keySet());
                for (Map.Entry<Long, Map<String, String>> row : after.entrySet()) {
                    Map<String, String> expected = new LinkedHashMap<>(before.get(row.getKey()));
                    expected.remove("index_id");
                    assertThat(row.getValue()).isEqualTo(expected);
                }
            }
        }

        @Test
        @DisplayName("matches the documented example row")
        void exampleScenario() throws SQLException {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                Map<String, String> row = SqliteTestSupport.rowsById(conn, "manifests").get(1L);

                assertThat(row).containsOnlyKeys(
                        "id", "image_id", "schema_version", "media_type", "annotations_json", "created_at", "modified_at");
                assertThat(row)
                        .containsEntry("id", "1")
                        .containsEntry("image_id", "7")
                        .containsEntry("schema_version", "2")
                        .containsEntry("media_type", OCI_MANIFEST)
                        .containsEntry("annotations_json", null);
            }
        }

        @Test
        @DisplayName("has the target shape: no index_id, no indexes table, image_id index")
        void schemaShape() throws SQLException {
            try (ConnectionPool.Lease lease = pool.acquire()) {
                SchemaInspector inspector = new SchemaInspector(lease.connection(), config.getType());

                assertThat(inspector.columnNames("manifests")).containsExactly(
                        "id", "image_id", "schema_version", "media_type", "annotations_json", "created_at", "modified_at");
                assertThat(inspector.tableExists("indexes")).isFalse();
                assertThat(inspector.tableExists("manifests_new")).isFalse();
                assertThat(inspector.indexExists("idx_manifests_index_id")).isFalse();
                assertThat(inspector.indexedColumns("idx_manifests_image_id")).containsExactly("image_id");
                assertThat(inspector.foreignKeys("manifests")).containsExactly(
                        new ForeignKeyDefinition("image_id", "images", "id", ForeignKeyAction.CASCADE));
            }
        }

        @Test
        @DisplayName("querying the retired indexes table fails")
        void indexesTableGone() throws SQLException {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                assertThatThrownBy(() -> SqliteTestSupport.count(conn, "indexes"))
                        .isInstanceOf(SQLException.class)
                        .hasMessageContaining("no such table: indexes");
            }
        }

        @Test
        @DisplayName("rejects manifests pointing at a missing image")
        void referentialIntegrity() throws SQLException {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                assertThatThrownBy(() -> SqliteTestSupport.execute(conn,
                        "INSERT INTO manifests (id, image_id, schema_version, media_type) "
                                + "VALUES (4, 404, 2, '" + OCI_MANIFEST + "')"))
                        .isInstanceOf(SQLException.class)
                        .hasMessageContaining("FOREIGN KEY");
            }
        }

        @Test
        @DisplayName("deleting an image still deletes its manifests")
        void cascadeDelete() throws SQLException {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                SqliteTestSupport.execute(conn, "DELETE FROM images WHERE id = 7");

                assertThat(SqliteTestSupport.rowsById(conn, "manifests")).containsOnlyKeys(2L);
            }
        }

        @Test
        @DisplayName("new rows get default timestamps")
        void defaultTimestamps() throws SQLException {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                SqliteTestSupport.execute(conn,
                        "INSERT INTO manifests (id, image_id, schema_version, media_type) "
                                + "VALUES (5, 8, 2, '" + OCI_MANIFEST + "')");

                Map<String, String> row = SqliteTestSupport.rowsById(conn, "manifests").get(5L);
                assertThat(row.get("created_at")).isNotNull();
                assertThat(row.get("modified_at")).isNotNull();
            }
        }

        @Test
        @DisplayName("lookups by image use the recreated index")
        void indexUsedByPlanner() throws SQLException {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                assertThat(SqliteTestSupport.queryPlan(conn, "SELECT * FROM manifests WHERE image_id = 7"))
                        .anySatisfy(detail -> assertThat(detail).contains("idx_manifests_image_id"));
            }
        }

        @Test
        @DisplayName("running the manager again changes nothing")
        void rerunThroughManager() throws Exception {
            try (Connection conn = SqliteTestSupport.connect(config)) {
                Map<Long, Map<String, String>> once = SqliteTestSupport.rowsById(conn, "manifests");

                assertThat(fullManager().migrate()).isEmpty();
                assertThat(SqliteTestSupport.rowsById(conn, "manifests")).isEqualTo(once);
            }
        }

        @Test
        @DisplayName("applying the steps a second time leaves the same final state")
        void rerunStepsDirectly() throws Exception {
            Map<Long, Map<String, String>> once;
            try (Connection conn = SqliteTestSupport.connect(config)) {
                once = SqliteTestSupport.rowsById(conn, "manifests");
            }

            try (ConnectionPool.Lease lease = pool.acquire()) {
                Connection conn = lease.connection();
                conn.setAutoCommit(false);
                new Version20251117071723().up(new MigrationContext(conn, config.getType()));
                conn.commit();
            }

            try (ConnectionPool.Lease lease = pool.acquire()) {
                SchemaInspector inspector = new SchemaInspector(lease.connection(), config.getType());
                assertThat(inspector.columnNames("manifests")).doesNotContain("index_id");
                assertThat(inspector.indexExists("idx_manifests_image_id")).isTrue();
                assertThat(inspector.tableExists("indexes")).isFalse();
                assertThat(SqliteTestSupport.rowsById(lease.connection(), "manifests")).isEqualTo(once);
            }
        }
    }

    @Test
    @DisplayName("cascade delete works before the migration too")
    void cascadeBefore() throws SQLException {
        seed();
        try (Connection conn = SqliteTestSupport.connect(config)) {
            SqliteTestSupport.execute(conn, "DELETE FROM images WHERE id = 8");

            assertThat(SqliteTestSupport.rowsById(conn, "manifests")).containsOnlyKeys(1L, 3L);
        }
    }

    @Test
    @DisplayName("an orphaned manifest aborts the migration and leaves the old schema intact")
    void orphanAbortsMigration() throws Exception {
        seed();
        try (Connection conn = SqliteTestSupport.connectWithoutForeignKeys(config)) {
            SqliteTestSupport.execute(conn,
                    "INSERT INTO manifests (id, index_id, image_id, schema_version, media_type) "
                            + "VALUES (9, NULL, 404, 2, '" + OCI_MANIFEST + "')");
        }

        MigrationManager manager = fullManager();
        assertThatThrownBy(manager::migrate)
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("20251117071723");

        try (ConnectionPool.Lease lease = pool.acquire()) {
            SchemaInspector inspector = new SchemaInspector(lease.connection(), config.getType());
            assertThat(inspector.columnNames("manifests")).contains("index_id");
            assertThat(inspector.tableExists("indexes")).isTrue();
            assertThat(inspector.tableExists("manifests_new")).isFalse();
            assertThat(inspector.indexExists("idx_manifests_index_id")).isTrue();
            assertThat(SqliteTestSupport.count(lease.connection(), "manifests")).isEqualTo(4);
            assertThat(SqliteTestSupport.count(lease.connection(), "indexes")).isEqualTo(1);
        }
        assertThat(manager.pending()).extracting(Migration::getVersion).containsExactly("20251117071723");
    }

    @Test
    @DisplayName("plans the rebuild before the index and the table drop")
    void stepOrder() {
        assertThat(new Version20251117071723().plan())
                .extracting(MigrationStep::id)
                .containsExactly(
                        "rebuild-table:manifests",
                        "create-index:idx_manifests_image_id",
                        "drop-table:indexes");
    }
}

package migrations;

import com.vcinsidedigital.oci_store.migration.Migration;

import java.util.List;

/**
 * Every migration of the OCI store, oldest first.
 */
public final class Migrations {

    private Migrations() {
    }

    public static List<Migration> all() {
        return List.of(
                new Version20250301120000(),
                new Version20251117071723());
    }
}

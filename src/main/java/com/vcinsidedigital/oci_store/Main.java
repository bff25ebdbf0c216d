package com.vcinsidedigital.oci_store;

import com.vcinsidedigital.oci_store.config.DatabaseConfig;
import com.vcinsidedigital.oci_store.migration.MigrationException;
import com.vcinsidedigital.oci_store.migration.MigrationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

/**
 * Migrates the configured database to the latest schema.
 * <p>
 * Usage: {@code Main [path/to/oci-store.properties]}. Without an argument the file is read from the
 * classpath. {@code -Doci-store.*} system properties override the file.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_RESOURCE = "oci-store.properties";

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(loadProperties(args, System.getProperties()));
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            exitCode = 2;
        }
        System.exit(exitCode);
    }

    static int run(Properties properties) {
        DatabaseConfig config = DatabaseConfig.fromProperties(properties);
        logger.info("Migrating {}", config);

        try (OciStoreDatabase database = new OciStoreDatabase(config)) {
            List<String> applied = database.migrate();
            logger.info("Applied {} migration(s): {}", applied.size(), applied);

            for (MigrationStatus status : database.status()) {
                logger.info("  {}", status);
            }
            return 0;
        } catch (MigrationException e) {
            logger.error("Migration failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    static Properties loadProperties(String[] args, Properties overrides) throws IOException {
        Properties properties = new Properties();

        if (args.length > 0) {
            try (Reader reader = Files.newBufferedReader(Path.of(args[0]), StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        } else {
            try (InputStream in = Main.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException(DEFAULT_RESOURCE + " not found on the classpath");
                }
                properties.load(in);
            }
        }

        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith(DatabaseConfig.PROPERTY_PREFIX)) {
                properties.setProperty(name, overrides.getProperty(name));
            }
        }
        return properties;
    }
}

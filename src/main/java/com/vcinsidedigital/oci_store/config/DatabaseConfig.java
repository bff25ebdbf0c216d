package com.vcinsidedigital.oci_store.config;

import java.util.Locale;
import java.util.Properties;

public class DatabaseConfig {
    public static final String PROPERTY_PREFIX = "oci-store.";

    private DatabaseType type;
    private String host;
    private int port;
    private String database;
    private String username;
    private String password;
    private String filePath; // SQLite only
    private String schema; // PostgreSQL only
    private int maxPoolSize = 10;
    private int minIdle = 2;
    private long connectionTimeout = 30000;

    private DatabaseConfig() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from {@code oci-store.*} keys.
     *
     * @param properties source properties
     * @return the built configuration
     * @throws IllegalArgumentException if a required key is missing or a number can't be parsed
     */
    public static DatabaseConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String type = required(properties, "db.type").trim().toLowerCase(Locale.ROOT);

        switch (type) {
            case "sqlite" -> builder.sqlite(required(properties, "db.path"));
            case "postgresql" -> builder.postgresql(
                    required(properties, "db.host"),
                    intValue(properties, "db.port", 5432),
                    required(properties, "db.name"));
            default -> throw new IllegalArgumentException(
                    "Unsupported database type '" + type + "' for key " + PROPERTY_PREFIX + "db.type");
        }

        String username = properties.getProperty(PROPERTY_PREFIX + "db.username");
        if (username != null) {
            builder.credentials(username, properties.getProperty(PROPERTY_PREFIX + "db.password", ""));
        }

        String schema = properties.getProperty(PROPERTY_PREFIX + "db.schema");
        if (schema != null) {
            builder.schema(schema);
        }

        builder.poolSize(intValue(properties, "pool.max-size", 10), intValue(properties, "pool.min-idle", 2));
        builder.connectionTimeout(intValue(properties, "pool.connection-timeout-ms", 30000));
        return builder.build();
    }

    private static String required(Properties properties, String key) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required property " + PROPERTY_PREFIX + key);
        }
        return value;
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property " + PROPERTY_PREFIX + key + " is not a number: " + value, e);
        }
    }

    public String getJdbcUrl() {
        return switch (type) {
            case SQLITE -> String.format("jdbc:sqlite:%s", filePath);
            case POSTGRESQL -> {
                String url = String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
                yield schema != null ? url + "?currentSchema=" + schema : url;
            }
        };
    }

    public String getDriverClassName() {
        return switch (type) {
            case SQLITE -> "org.sqlite.JDBC";
            case POSTGRESQL -> "org.postgresql.Driver";
        };
    }

    /**
     * Driver properties applied to every new connection. SQLite ships with foreign keys
     * disabled per connection, so they are switched on here.
     */
    public Properties getConnectionProperties() {
        Properties props = new Properties();
        if (username != null) {
            props.setProperty("user", username);
            props.setProperty("password", password != null ? password : "");
        }
        if (type == DatabaseType.SQLITE) {
            props.setProperty("foreign_keys", "true");
        }
        return props;
    }

    // Getters
    public DatabaseType getType() { return type; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getFilePath() { return filePath; }
    public String getSchema() { return schema; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public int getMinIdle() { return minIdle; }
    public long getConnectionTimeout() { return connectionTimeout; }

    @Override
    public String toString() {
        // password left out on purpose
        return "DatabaseConfig{type=" + type + ", url=" + getJdbcUrl() + ", username=" + username + "}";
    }

    public static class Builder {
        private final DatabaseConfig config = new DatabaseConfig();

        public Builder sqlite(String filePath) {
            config.type = DatabaseType.SQLITE;
            config.filePath = filePath;
            return this;
        }

        public Builder postgresql(String host, int port, String database) {
            config.type = DatabaseType.POSTGRESQL;
            config.host = host;
            config.port = port;
            config.database = database;
            return this;
        }

        /**
         * PostgreSQL on the default port (5432).
         */
        public Builder postgresql(String host, String database) {
            return postgresql(host, 5432, database);
        }

        public Builder credentials(String username, String password) {
            config.username = username;
            config.password = password;
            return this;
        }

        public Builder schema(String schema) {
            config.schema = schema;
            return this;
        }

        public Builder poolSize(int maxPoolSize, int minIdle) {
            if (maxPoolSize < 1 || minIdle < 0 || minIdle > maxPoolSize) {
                throw new IllegalArgumentException(
                        "Invalid pool size: max=" + maxPoolSize + ", minIdle=" + minIdle);
            }
            config.maxPoolSize = maxPoolSize;
            config.minIdle = minIdle;
            return this;
        }

        public Builder connectionTimeout(long millis) {
            if (millis <= 0) {
                throw new IllegalArgumentException("Connection timeout must be positive: " + millis);
            }
            config.connectionTimeout = millis;
            return this;
        }

        public DatabaseConfig build() {
            if (config.type == null) {
                throw new IllegalStateException("Database type not specified");
            }
            return config;
        }
    }

    public enum DatabaseType {
        SQLITE,
        POSTGRESQL
    }
}

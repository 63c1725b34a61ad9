package com.telcobright.partman.core.config;

/**
 * Connection settings for the database holding the managed tables and {@code partition_config}.
 */
public class DataSourceConfig {

    private static final String URL_PARAMETERS =
        "useSSL=false&allowPublicKeyRetrieval=true&connectionTimeZone=UTC&forceConnectionTimeZoneToSession=true";

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;

    private DataSourceConfig(String host, int port, String database, String username, String password) {
        this.host = host;
        this.port = port;
        this.database = database;
        this.username = username;
        this.password = password;
    }

    /**
     * @param password may be {@code null} for an account without one
     * @throws IllegalArgumentException when host, database or user is blank, or the port is out of range
     */
    public static DataSourceConfig create(String host, int port, String database, String username, String password) {
        requireText(host, "Database host");
        requireText(database, "Database name");
        requireText(username, "Database user");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Database port must be between 1 and 65535, got " + port);
        }
        return new DataSourceConfig(host.trim(), port, database.trim(), username, password != null ? password : "");
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
    }

    /**
     * Sessions run in UTC, so TIMESTAMP columns read back as instants. Migration shifts
     * them to the partition offset itself when deriving partition days.
     */
    public String getJdbcUrl() {
        return "jdbc:mysql://" + host + ":" + port + "/" + database + "?" + URL_PARAMETERS;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }

    @Override
    public String toString() {
        return username + "@" + host + ":" + port + "/" + database;
    }
}

package org.epistula.backup.config;

import org.epistula.backup.JdbcUtils;
import org.epistula.backup.PgConnectionSettings;
import org.eclipse.microprofile.config.spi.ConfigSource;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Publishes the {@code DB_*} connection settings twice: as the Quarkus datasource and as the
 * {@code epistula.backups.pg.*} keys the pg_dump and psql invocations are built from, so both always
 * point at the same database.
 */
public class PostgresConnectionConfigSource implements ConfigSource {
    public static final String PG_HOST = "epistula.backups.pg.host";
    public static final String PG_PORT = "epistula.backups.pg.port";
    public static final String PG_DATABASE = "epistula.backups.pg.database";
    public static final String PG_USERNAME = "epistula.backups.pg.username";
    public static final String PG_PASSWORD = "epistula.backups.pg.password";

    private final Map<String, String> properties;

    public PostgresConnectionConfigSource() {
        this(JdbcUtils.resolveConnectionSettings());
    }

    PostgresConnectionConfigSource(PgConnectionSettings settings) {
        Map<String, String> values = new HashMap<>();
        values.put("quarkus.datasource.jdbc.url",
                JdbcUtils.buildConnectionURL(settings.getHost(), settings.getPort(), settings.getDatabase()));
        values.put("quarkus.datasource.username", settings.getUsername());
        values.put("quarkus.datasource.password", settings.getPassword());
        values.put(PG_HOST, settings.getHost());
        values.put(PG_PORT, settings.getPort());
        values.put(PG_DATABASE, settings.getDatabase());
        values.put(PG_USERNAME, settings.getUsername());
        values.put(PG_PASSWORD, settings.getPassword());
        this.properties = Collections.unmodifiableMap(values);
    }

    @Override
    public Map<String, String> getProperties() {
        return properties;
    }

    @Override
    public Set<String> getPropertyNames() {
        return properties.keySet();
    }

    @Override
    public String getValue(String propertyName) {
        return properties.get(propertyName);
    }

    @Override
    public String getName() {
        return "EpistulaPostgresConnectionConfigSource";
    }
}

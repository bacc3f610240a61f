package org.epistula.backup;

import lombok.Value;

/**
 * Connection parameters handed to the PostgreSQL client tools.
 * The password travels through the {@code PGPASSWORD} environment variable, never the command line.
 */
@Value
public class PgConnectionSettings {
    String host;
    String port;
    String database;
    String username;
    String password;
}

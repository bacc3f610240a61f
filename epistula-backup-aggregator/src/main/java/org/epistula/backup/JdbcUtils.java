package org.epistula.backup;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
@Slf4j
public class JdbcUtils {

    private static final String SSL_URL_PARAMS = "?sslmode=require";

    public static String buildConnectionURL(String pgHost, String pgPort, String pgDatabase) {
        String url = String.format("jdbc:postgresql://%s:%s/%s", pgHost, pgPort, pgDatabase);
        if (isSslRequired()) {
            log.debug("Going to use secured connection to postgres");
            url += SSL_URL_PARAMS;
        }
        return url;
    }

    public static PgConnectionSettings resolveConnectionSettings() {
        return new PgConnectionSettings(resolveHost(), resolvePort(), resolveDatabase(), resolveUsername(), resolvePassword());
    }

    public static String resolveHost() {
        return getEnvOrProperty("DB_HOST", "database");
    }

    public static String resolvePort() {
        return getEnvOrProperty("DB_PORT", "5432");
    }

    public static String resolveDatabase() {
        return getEnvOrProperty("DB_NAME", "epistula");
    }

    public static String resolveUsername() {
        return getEnvOrProperty("DB_USER", "epistula_user");
    }

    public static String resolvePassword() {
        return getEnvOrProperty("DB_PASSWORD", "");
    }

    private static boolean isSslRequired() {
        return Boolean.parseBoolean(getEnvOrProperty("DB_SSL_REQUIRED", "false"));
    }

    static String getEnvOrProperty(String name, String defaultValue) {
        return System.getProperty(name, System.getenv().getOrDefault(name, defaultValue));
    }
}

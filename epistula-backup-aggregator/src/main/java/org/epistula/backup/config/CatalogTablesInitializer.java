package org.epistula.backup.config;

import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Creates the bookkeeping tables owned by the backup service. The tenant catalog itself
 * ({@code public.universities}) is maintained by the platform migrations.
 */
@Slf4j
@ApplicationScoped
public class CatalogTablesInitializer {

    static final List<String> DDL = List.of(
            "CREATE TABLE IF NOT EXISTS " + ServicesConfig.LOCK_TABLE + " ("
                    + "name VARCHAR(64) NOT NULL PRIMARY KEY, "
                    + "lock_until TIMESTAMP NOT NULL, "
                    + "locked_at TIMESTAMP NOT NULL, "
                    + "locked_by VARCHAR(255) NOT NULL)",
            "CREATE TABLE IF NOT EXISTS public.university_backups_meta ("
                    + "id BIGSERIAL PRIMARY KEY, "
                    + "university_id INTEGER NOT NULL REFERENCES public.universities(id) ON DELETE CASCADE, "
                    + "filename VARCHAR(255) NOT NULL, "
                    + "title VARCHAR(255), "
                    + "description TEXT, "
                    + "created_by INTEGER, "
                    + "created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), "
                    + "updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), "
                    + "UNIQUE (university_id, filename))");

    private final DataSource dataSource;

    public CatalogTablesInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    void onStart(@Observes @Priority(10) StartupEvent event) throws SQLException {
        log.info("Ensuring backup bookkeeping tables exist");
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : DDL) {
                statement.execute(ddl);
            }
        }
    }
}

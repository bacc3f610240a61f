package org.epistula.backup.repositories;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.epistula.backup.utils.SchemaNames;

/**
 * Schema level DDL against the shared database. Each method runs in its own transaction unless the caller
 * already opened one, so a caller can group several statements into a single commit.
 */
@Slf4j
@Transactional
@ApplicationScoped
public class SchemaCatalogRepository {

    private final EntityManager entityManager;

    public SchemaCatalogRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public boolean schemaExists(String schema) {
        Number count = (Number) entityManager
                .createNativeQuery("SELECT count(*) FROM information_schema.schemata WHERE schema_name = :schema")
                .setParameter("schema", schema)
                .getSingleResult();
        return count.longValue() > 0;
    }

    public boolean tableExists(String schema, String table) {
        Number count = (Number) entityManager
                .createNativeQuery("SELECT count(*) FROM information_schema.tables WHERE table_schema = :schema AND table_name = :table")
                .setParameter("schema", schema)
                .setParameter("table", table)
                .getSingleResult();
        return count.longValue() > 0;
    }

    public long countRows(String schema, String table) {
        Number count = (Number) entityManager
                .createNativeQuery("SELECT count(*) FROM " + SchemaNames.quote(schema) + "." + SchemaNames.quote(table))
                .getSingleResult();
        return count.longValue();
    }

    public void recreateSchema(String schema) {
        String quoted = SchemaNames.quote(schema);
        log.info("Recreating schema {}", schema);
        entityManager.createNativeQuery("DROP SCHEMA IF EXISTS " + quoted + " CASCADE").executeUpdate();
        entityManager.createNativeQuery("CREATE SCHEMA " + quoted).executeUpdate();
    }

    public void dropSchemaIfExists(String schema) {
        log.info("Dropping schema {} if it exists", schema);
        entityManager.createNativeQuery("DROP SCHEMA IF EXISTS " + SchemaNames.quote(schema) + " CASCADE").executeUpdate();
    }

    public void renameSchema(String from, String to) {
        log.info("Renaming schema {} to {}", from, to);
        entityManager.createNativeQuery("ALTER SCHEMA " + SchemaNames.quote(from) + " RENAME TO " + SchemaNames.quote(to)).executeUpdate();
    }
}

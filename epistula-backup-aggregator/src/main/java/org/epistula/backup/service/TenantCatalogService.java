package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.epistula.backup.entity.Tenant;
import org.epistula.backup.repositories.SchemaCatalogRepository;
import org.epistula.backup.repositories.TenantRepository;
import org.epistula.backup.utils.SchemaNames;

import java.util.Optional;

/**
 * Keeps schemas and their catalog rows in step. Each public method commits schema DDL and the row change together.
 */
@Slf4j
@ApplicationScoped
public class TenantCatalogService {

    static final int MAX_CODE_LENGTH = 50;
    static final String TEMP_NAME_SUFFIX = " (temp)";
    static final String TEMP_CODE_SUFFIX = "_TEMP";
    static final String TEMP_DESCRIPTION = "Temporary restoration workspace for validation/export";

    private final TenantRepository tenantRepository;
    private final SchemaCatalogRepository schemaCatalogRepository;

    public TenantCatalogService(TenantRepository tenantRepository, SchemaCatalogRepository schemaCatalogRepository) {
        this.tenantRepository = tenantRepository;
        this.schemaCatalogRepository = schemaCatalogRepository;
    }

    public Optional<Tenant> findTempWorkspace(Tenant production) {
        return tenantRepository.findBySchemaName(SchemaNames.tempOf(production.getSchemaName()));
    }

    /**
     * Creates or refreshes the inactive catalog row describing the tenant's temporary workspace.
     */
    @Transactional
    public Tenant registerTempWorkspace(Tenant production) {
        String tempSchema = SchemaNames.tempOf(production.getSchemaName());
        Tenant row = tenantRepository.findBySchemaName(tempSchema).orElseGet(Tenant::new);
        boolean created = row.getId() == null;
        row.setName(production.getName() + TEMP_NAME_SUFFIX);
        row.setCode(StringUtils.left(production.getCode() + TEMP_CODE_SUFFIX, MAX_CODE_LENGTH));
        row.setSchemaName(tempSchema);
        row.setDescription(TEMP_DESCRIPTION);
        row.setActive(false);
        if (created) {
            row.setCreatedBy(production.getCreatedBy());
            tenantRepository.persist(row);
        }
        log.info("{} temp workspace row {} for schema {}", created ? "Registered" : "Refreshed", row.getId(), tempSchema);
        return row;
    }

    /**
     * Drops the temporary schema, if present, and removes its catalog row.
     *
     * @return whether a catalog row was removed
     */
    @Transactional
    public boolean destroyTempWorkspace(Tenant production) {
        String tempSchema = SchemaNames.tempOf(production.getSchemaName());
        schemaCatalogRepository.dropSchemaIfExists(tempSchema);
        long removed = tenantRepository.delete("schemaName", tempSchema);
        log.info("Destroyed temp workspace {} of tenant {}, catalog rows removed: {}", tempSchema, production.getId(), removed);
        return removed > 0;
    }

    /**
     * Final step of a promotion: the replaced schema is dropped and the temp workspace row removed.
     */
    @Transactional
    public boolean finishPromotion(Tenant production) {
        String productionSchema = SchemaNames.validate(production.getSchemaName());
        schemaCatalogRepository.dropSchemaIfExists(SchemaNames.oldOf(productionSchema));
        long removed = tenantRepository.delete("schemaName", SchemaNames.tempOf(productionSchema));
        return removed > 0;
    }

    /**
     * Drops the tenant's schema and deletes its catalog row.
     */
    @Transactional
    public void dropTenant(Tenant tenant) {
        schemaCatalogRepository.dropSchemaIfExists(SchemaNames.validate(tenant.getSchemaName()));
        tenantRepository.deleteById(tenant.getId());
        log.info("Dropped schema {} and catalog row of tenant {}", tenant.getSchemaName(), tenant.getId());
    }
}

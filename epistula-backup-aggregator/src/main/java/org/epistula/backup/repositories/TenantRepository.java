package org.epistula.backup.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.epistula.backup.entity.Tenant;
import org.epistula.backup.exceptions.TenantNotFoundException;

import java.util.List;
import java.util.Optional;

@Transactional
@ApplicationScoped
public class TenantRepository implements PanacheRepositoryBase<Tenant, Integer> {

    public Tenant getTenant(int tenantId) {
        return findByIdOptional(tenantId).orElseThrow(() -> new TenantNotFoundException(tenantId));
    }

    public Optional<Tenant> findBySchemaName(String schemaName) {
        return find("schemaName", schemaName).firstResultOptional();
    }

    public List<Tenant> listActive() {
        return list("active = ?1", Sort.by("id"), true);
    }
}

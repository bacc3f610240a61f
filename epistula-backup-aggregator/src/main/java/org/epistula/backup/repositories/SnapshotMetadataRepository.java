package org.epistula.backup.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.epistula.backup.entity.SnapshotMetadata;

import java.util.List;
import java.util.Optional;

@Transactional
@ApplicationScoped
public class SnapshotMetadataRepository implements PanacheRepositoryBase<SnapshotMetadata, Long> {

    private static final String UPSERT = "INSERT INTO public.university_backups_meta "
            + "(university_id, filename, title, description, created_by) VALUES (:tenantId, :filename, :title, :description, :createdBy) "
            + "ON CONFLICT (university_id, filename) DO UPDATE SET "
            + "title = EXCLUDED.title, description = EXCLUDED.description, updated_at = NOW()";

    public List<SnapshotMetadata> findByTenant(int tenantId) {
        return list("tenantId", tenantId);
    }

    public Optional<SnapshotMetadata> findByTenantAndFilename(int tenantId, String filename) {
        return find("tenantId = ?1 and filename = ?2", tenantId, filename).firstResultOptional();
    }

    public void upsert(int tenantId, String filename, String title, String description, Integer createdBy) {
        getEntityManager().createNativeQuery(UPSERT)
                .setParameter("tenantId", tenantId)
                .setParameter("filename", filename)
                .setParameter("title", title)
                .setParameter("description", description)
                .setParameter("createdBy", createdBy)
                .executeUpdate();
    }

    public long deleteByTenantAndFilename(int tenantId, String filename) {
        return delete("tenantId = ?1 and filename = ?2", tenantId, filename);
    }

    public long deleteByTenant(int tenantId) {
        return delete("tenantId", tenantId);
    }
}

package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.epistula.backup.dto.AllSnapshotsResponse;
import org.epistula.backup.dto.SnapshotInfo;
import org.epistula.backup.dto.SnapshotMetadataRequest;
import org.epistula.backup.dto.SnapshotMetadataResponse;
import org.epistula.backup.dto.TenantSnapshots;
import org.epistula.backup.entity.Tenant;
import org.epistula.backup.exceptions.ErrorCodeException;
import org.epistula.backup.repositories.SnapshotMetadataRepository;
import org.epistula.backup.repositories.TenantRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read side of the snapshot store plus the user-editable title and description of each snapshot.
 */
@Slf4j
@ApplicationScoped
public class SnapshotCatalogService {

    private final TenantRepository tenantRepository;
    private final SnapshotMetadataRepository metadataRepository;
    private final SnapshotStore snapshotStore;

    public SnapshotCatalogService(TenantRepository tenantRepository,
                                  SnapshotMetadataRepository metadataRepository,
                                  SnapshotStore snapshotStore) {
        this.tenantRepository = tenantRepository;
        this.metadataRepository = metadataRepository;
        this.snapshotStore = snapshotStore;
    }

    public TenantSnapshots listSnapshots(int tenantId) {
        Tenant tenant = tenantRepository.getTenant(tenantId);
        return describe(tenant, snapshotStore.listSnapshots(tenantId));
    }

    /**
     * Snapshots grouped by active tenant. Tenants without snapshots, or whose directory cannot be read, are left out.
     */
    public AllSnapshotsResponse listAllSnapshots() {
        List<TenantSnapshots> tenants = new ArrayList<>();
        int total = 0;
        for (Tenant tenant : tenantRepository.listActive()) {
            List<SnapshotInfo> snapshots;
            try {
                snapshots = snapshotStore.listSnapshots(tenant.getId());
            } catch (ErrorCodeException e) {
                log.warn("Cannot list snapshots of tenant {}: {}", tenant.getId(), e.getDetail());
                snapshots = Collections.emptyList();
            }
            if (!snapshots.isEmpty()) {
                total += snapshots.size();
                tenants.add(describe(tenant, snapshots));
            }
        }
        return AllSnapshotsResponse.builder().tenants(tenants).totalSnapshots(total).build();
    }

    public SnapshotMetadataResponse getMetadata(int tenantId, String filename) {
        tenantRepository.getTenant(tenantId);
        snapshotStore.findSnapshot(tenantId, filename);
        SnapshotMetadataResponse.SnapshotMetadataResponseBuilder response = SnapshotMetadataResponse.builder()
                .tenantId(tenantId)
                .filename(filename);
        metadataRepository.findByTenantAndFilename(tenantId, filename).ifPresent(meta -> response
                .title(meta.getTitle())
                .description(meta.getDescription()));
        return response.build();
    }

    public SnapshotMetadataResponse saveMetadata(int tenantId, String filename, SnapshotMetadataRequest request) {
        tenantRepository.getTenant(tenantId);
        snapshotStore.findSnapshot(tenantId, filename);
        metadataRepository.upsert(tenantId, filename, request.getTitle(), request.getDescription(), request.getCreatedBy());
        log.info("Updated metadata of snapshot {} for tenant {}", filename, tenantId);
        return SnapshotMetadataResponse.builder()
                .tenantId(tenantId)
                .filename(filename)
                .title(request.getTitle())
                .description(request.getDescription())
                .build();
    }

    private static TenantSnapshots describe(Tenant tenant, List<SnapshotInfo> snapshots) {
        return TenantSnapshots.builder()
                .tenantId(tenant.getId())
                .tenantName(tenant.getName())
                .schemaName(tenant.getSchemaName())
                .snapshots(snapshots)
                .build();
    }
}

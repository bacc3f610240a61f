package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.epistula.backup.dto.DiscardResult;
import org.epistula.backup.dto.LifecycleState;
import org.epistula.backup.dto.PromotionResult;
import org.epistula.backup.dto.TempWorkspaceStatus;
import org.epistula.backup.dto.TenantDeletionResult;
import org.epistula.backup.entity.Tenant;
import org.epistula.backup.exceptions.TempSchemaNotFoundException;
import org.epistula.backup.repositories.SchemaCatalogRepository;
import org.epistula.backup.repositories.TenantRepository;
import org.epistula.backup.utils.SchemaNames;
import org.epistula.backup.utils.SnapshotNames;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moves a tenant between having only its production schema and validating a restored copy next to it.
 * <pre>
 * PRODUCTION_ONLY --restore to temp--> VALIDATING --promote--> PRODUCTION_ONLY
 *                                      VALIDATING --discard--> PRODUCTION_ONLY
 * </pre>
 */
@Slf4j
@ApplicationScoped
public class SchemaLifecycleService {

    static final String FACULTIES_TABLE = "faculties";
    static final String USERS_TABLE = "users";

    private final TenantRepository tenantRepository;
    private final SchemaCatalogRepository schemaCatalogRepository;
    private final TenantCatalogService tenantCatalogService;
    private final SchemaDumpService dumpService;
    private final SnapshotStore snapshotStore;
    private final TenantOperationLock operationLock;
    private final Clock clock;

    public SchemaLifecycleService(TenantRepository tenantRepository,
                                  SchemaCatalogRepository schemaCatalogRepository,
                                  TenantCatalogService tenantCatalogService,
                                  SchemaDumpService dumpService,
                                  SnapshotStore snapshotStore,
                                  TenantOperationLock operationLock,
                                  Clock clock) {
        this.tenantRepository = tenantRepository;
        this.schemaCatalogRepository = schemaCatalogRepository;
        this.tenantCatalogService = tenantCatalogService;
        this.dumpService = dumpService;
        this.snapshotStore = snapshotStore;
        this.operationLock = operationLock;
        this.clock = clock;
    }

    public LifecycleState currentState(int tenantId) {
        Tenant tenant = tenantRepository.getTenant(tenantId);
        return LifecycleState.of(schemaCatalogRepository.schemaExists(SchemaNames.tempOf(tenant.getSchemaName())));
    }

    /**
     * Replaces the production schema with the validated temporary one. A safety snapshot of production is
     * taken first; when it fails no schema is touched.
     */
    public PromotionResult promote(int tenantId) {
        return operationLock.callWithLock(tenantId, "promote", () -> {
            Tenant tenant = tenantRepository.getTenant(tenantId);
            String productionSchema = SchemaNames.validate(tenant.getSchemaName());
            String tempSchema = SchemaNames.tempOf(productionSchema);
            String oldSchema = SchemaNames.oldOf(productionSchema);

            LifecycleState state = LifecycleState.of(schemaCatalogRepository.schemaExists(tempSchema));
            if (!state.canTransitionTo(LifecycleState.PROMOTED)) {
                throw new TempSchemaNotFoundException(tempSchema, "nothing to promote, restore a snapshot to temp first");
            }

            log.info("Promoting {} to {} for tenant {}", tempSchema, productionSchema, tenantId);
            Path safety = dumpService.dump(tenantId, SnapshotNames.timestampedLabel(SnapshotNames.PRE_PROMOTE, clock.instant()));

            schemaCatalogRepository.dropSchemaIfExists(oldSchema);
            schemaCatalogRepository.renameSchema(productionSchema, oldSchema);
            schemaCatalogRepository.renameSchema(tempSchema, productionSchema);
            tenantCatalogService.finishPromotion(tenant);
            log.info("Promotion of tenant {} finished, safety snapshot {}", tenantId, safety.getFileName());

            return PromotionResult.builder()
                    .tenantId(tenantId)
                    .productionSchema(productionSchema)
                    .promotedFrom(tempSchema)
                    .safetySnapshot(safety.getFileName().toString())
                    .state(LifecycleState.PROMOTED)
                    .build();
        });
    }

    /**
     * Drops the temporary schema, if any, and its catalog row. Production is never touched.
     */
    public DiscardResult discardTemp(int tenantId) {
        return operationLock.callWithLock(tenantId, "discard temp", () -> {
            Tenant tenant = tenantRepository.getTenant(tenantId);
            String tempSchema = SchemaNames.tempOf(tenant.getSchemaName());
            log.info("Discarding temp workspace {} of tenant {}", tempSchema, tenantId);
            boolean rowRemoved = tenantCatalogService.destroyTempWorkspace(tenant);
            return DiscardResult.builder()
                    .tenantId(tenantId)
                    .tempSchema(tempSchema)
                    .catalogRowRemoved(rowRemoved)
                    .state(LifecycleState.DISCARDED)
                    .build();
        });
    }

    /**
     * Re-registers the catalog row of an existing temporary schema.
     */
    public int ensureTempWorkspace(int tenantId) {
        return operationLock.callWithLock(tenantId, "ensure temp workspace", () -> {
            Tenant tenant = tenantRepository.getTenant(tenantId);
            String tempSchema = SchemaNames.tempOf(tenant.getSchemaName());
            if (!schemaCatalogRepository.schemaExists(tempSchema)) {
                throw new TempSchemaNotFoundException(tempSchema, "restore a snapshot to temp first");
            }
            return tenantCatalogService.registerTempWorkspace(tenant).getId();
        });
    }

    public TempWorkspaceStatus getTempStatus(int tenantId) {
        Tenant tenant = tenantRepository.getTenant(tenantId);
        String tempSchema = SchemaNames.tempOf(tenant.getSchemaName());
        boolean exists = schemaCatalogRepository.schemaExists(tempSchema);
        TempWorkspaceStatus.TempWorkspaceStatusBuilder status = TempWorkspaceStatus.builder()
                .tenantId(tenantId)
                .tenantName(tenant.getName())
                .productionSchema(tenant.getSchemaName())
                .tempSchema(tempSchema)
                .hasTempSchema(exists)
                .state(LifecycleState.of(exists));
        if (exists) {
            tenantCatalogService.findTempWorkspace(tenant).ifPresent(row -> status.tempTenantId(row.getId()));
            try {
                status.facultyCount(countIfPresent(tempSchema, FACULTIES_TABLE));
                status.userCount(countIfPresent(tempSchema, USERS_TABLE));
            } catch (PersistenceException e) {
                log.warn("Cannot collect statistics of {}: {}", tempSchema, e.getMessage());
                status.statsError(e.getMessage());
            }
        }
        return status.build();
    }

    /**
     * Removes a tenant together with its schemas. Production snapshots are kept in a renamed directory,
     * a temporary workspace's snapshots are purged locally and remotely.
     */
    public TenantDeletionResult deleteTenant(int tenantId) {
        return operationLock.callWithLock(tenantId, "delete tenant", () -> {
            Tenant tenant = tenantRepository.getTenant(tenantId);
            String schema = SchemaNames.validate(tenant.getSchemaName());
            boolean tempWorkspace = !tenant.isActive() && SchemaNames.isTemp(schema);
            List<String> dropped = new ArrayList<>();
            TenantDeletionResult.TenantDeletionResultBuilder result = TenantDeletionResult.builder()
                    .tenantId(tenantId)
                    .schemaName(schema)
                    .tempWorkspace(tempWorkspace);

            if (tempWorkspace) {
                tenantCatalogService.dropTenant(tenant);
                dropped.add(schema);
                result.purgedSnapshots(snapshotStore.purgeTenantDirectory(tenantId, true));
            } else {
                String tempSchema = SchemaNames.tempOf(schema);
                tenantCatalogService.destroyTempWorkspace(tenant);
                dropped.add(tempSchema);
                tenantCatalogService.dropTenant(tenant);
                dropped.add(schema);
                Optional<Path> preserved = snapshotStore.preserveTenantDirectory(tenantId);
                preserved.ifPresent(path -> result.preservedSnapshotDirectory(path.toString()));
            }
            log.info("Deleted tenant {} ({}), dropped schemas {}", tenantId, schema, dropped);
            return result.droppedSchemas(dropped).build();
        });
    }

    private Long countIfPresent(String schema, String table) {
        return schemaCatalogRepository.tableExists(schema, table) ? schemaCatalogRepository.countRows(schema, table) : null;
    }
}

package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.epistula.backup.dto.LifecycleState;
import org.epistula.backup.dto.RestoreResult;
import org.epistula.backup.entity.Tenant;
import org.epistula.backup.exceptions.RestoreFailedException;
import org.epistula.backup.exceptions.RestoreTimeoutException;
import org.epistula.backup.exceptions.SnapshotStorageException;
import org.epistula.backup.repositories.SchemaCatalogRepository;
import org.epistula.backup.repositories.TenantRepository;
import org.epistula.backup.utils.SchemaNames;
import org.epistula.backup.utils.SchemaRewriter;
import org.epistula.backup.utils.SnapshotNames;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.zip.GZIPInputStream;

/**
 * Loads a snapshot into the tenant's production schema or into its temporary validation schema.
 */
@Slf4j
@ApplicationScoped
public class SchemaRestoreService {

    private final TenantRepository tenantRepository;
    private final SchemaCatalogRepository schemaCatalogRepository;
    private final TenantCatalogService tenantCatalogService;
    private final SnapshotStore snapshotStore;
    private final SchemaDumpService dumpService;
    private final PgClientTools pgClientTools;
    private final TenantOperationLock operationLock;
    private final Clock clock;
    private final Duration restoreTimeout;

    public SchemaRestoreService(TenantRepository tenantRepository,
                                SchemaCatalogRepository schemaCatalogRepository,
                                TenantCatalogService tenantCatalogService,
                                SnapshotStore snapshotStore,
                                SchemaDumpService dumpService,
                                PgClientTools pgClientTools,
                                TenantOperationLock operationLock,
                                Clock clock,
                                @ConfigProperty(name = "epistula.backups.restore-timeout", defaultValue = "PT300S") Duration restoreTimeout) {
        this.tenantRepository = tenantRepository;
        this.schemaCatalogRepository = schemaCatalogRepository;
        this.tenantCatalogService = tenantCatalogService;
        this.snapshotStore = snapshotStore;
        this.dumpService = dumpService;
        this.pgClientTools = pgClientTools;
        this.operationLock = operationLock;
        this.clock = clock;
        this.restoreTimeout = restoreTimeout;
    }

    public RestoreResult restore(int tenantId, String filename, boolean toTemp) {
        return operationLock.callWithLock(tenantId, toTemp ? "restore to temp" : "restore", () -> doRestore(tenantId, filename, toTemp));
    }

    private RestoreResult doRestore(int tenantId, String filename, boolean toTemp) {
        Tenant tenant = tenantRepository.getTenant(tenantId);
        String productionSchema = SchemaNames.validate(tenant.getSchemaName());
        String targetSchema = toTemp ? SchemaNames.tempOf(productionSchema) : productionSchema;
        Path snapshot = snapshotStore.findSnapshot(tenantId, filename);

        String safetySnapshot = null;
        if (!toTemp) {
            log.info("Taking safety snapshot of {} before overwriting it", productionSchema);
            Path safety = dumpService.dump(tenantId, SnapshotNames.timestampedLabel(SnapshotNames.PRE_RESTORE, clock.instant()));
            safetySnapshot = safety.getFileName().toString();
        }

        log.info("Restoring {} of tenant {} into schema {}", filename, tenantId, targetSchema);
        schemaCatalogRepository.recreateSchema(targetSchema);
        long started = System.currentTimeMillis();
        ToolExecution execution;
        try (InputStream script = openScript(snapshot, productionSchema, targetSchema)) {
            execution = pgClientTools.executeSql(script, restoreTimeout);
        } catch (TimeoutException e) {
            log.error("Restore of {} into {} timed out after {}", filename, targetSchema, restoreTimeout);
            throw new RestoreTimeoutException(targetSchema, restoreTimeout, e);
        } catch (IOException e) {
            throw new SnapshotStorageException("cannot stream snapshot " + filename + " to psql", e);
        }
        if (!execution.isSuccessful()) {
            log.error("psql restore of {} into {} failed with exit code {}: {}",
                    filename, targetSchema, execution.getExitCode(), execution.getStderr());
            throw new RestoreFailedException(targetSchema, execution.getExitCode(), execution.getStderr());
        }
        log.info("Restored {} into {} in {} ms", filename, targetSchema, System.currentTimeMillis() - started);
        if (!toTemp) {
            // the restored snapshot may be the oldest file, so pruning waits until psql has read it
            snapshotStore.enforceRetention(tenantId);
        }

        RestoreResult.RestoreResultBuilder result = RestoreResult.builder()
                .tenantId(tenantId)
                .snapshot(filename)
                .productionSchema(productionSchema)
                .targetSchema(targetSchema)
                .toTemp(toTemp)
                .safetySnapshot(safetySnapshot)
                .state(toTemp ? LifecycleState.VALIDATING : LifecycleState.of(schemaCatalogRepository.schemaExists(SchemaNames.tempOf(productionSchema))));
        if (toTemp) {
            result.tempTenantId(registerTempWorkspace(tenant));
        }
        return result.build();
    }

    private Integer registerTempWorkspace(Tenant tenant) {
        try {
            return tenantCatalogService.registerTempWorkspace(tenant).getId();
        } catch (RuntimeException e) {
            log.error("Failed to register temp workspace of tenant {}, dropping the restored schema", tenant.getId(), e);
            try {
                tenantCatalogService.destroyTempWorkspace(tenant);
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * Production restores stream the decompressed dump straight through. Temp restores rewrite schema
     * references in memory first.
     */
    private InputStream openScript(Path snapshot, String productionSchema, String targetSchema) throws IOException {
        InputStream decompressed = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(snapshot)));
        if (productionSchema.equals(targetSchema)) {
            return decompressed;
        }
        try (InputStream in = decompressed) {
            String sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return new ByteArrayInputStream(SchemaRewriter.rewrite(sql, productionSchema, targetSchema).getBytes(StandardCharsets.UTF_8));
        }
    }
}

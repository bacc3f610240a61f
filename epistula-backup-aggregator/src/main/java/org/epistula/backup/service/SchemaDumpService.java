package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.epistula.backup.dto.SnapshotCreatedResponse;
import org.epistula.backup.entity.Tenant;
import org.epistula.backup.exceptions.DumpFailedException;
import org.epistula.backup.exceptions.SnapshotStorageException;
import org.epistula.backup.repositories.TenantRepository;
import org.epistula.backup.utils.SchemaNames;
import org.epistula.backup.utils.SnapshotNames;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;

/**
 * Produces gzip-compressed plain SQL snapshots of a tenant schema and mirrors them to object storage.
 */
@Slf4j
@ApplicationScoped
public class SchemaDumpService {

    private final TenantRepository tenantRepository;
    private final SnapshotStore snapshotStore;
    private final SnapshotMirror mirror;
    private final PgClientTools pgClientTools;
    private final Clock clock;

    public SchemaDumpService(TenantRepository tenantRepository,
                             SnapshotStore snapshotStore,
                             SnapshotMirror mirror,
                             PgClientTools pgClientTools,
                             Clock clock) {
        this.tenantRepository = tenantRepository;
        this.snapshotStore = snapshotStore;
        this.mirror = mirror;
        this.pgClientTools = pgClientTools;
        this.clock = clock;
    }

    public Path dump(int tenantId) {
        return dump(tenantId, null);
    }

    /**
     * Dumps the tenant schema into {@code <schema>_<label>.sql.gz}; today's UTC date is used when no label is given.
     * An existing file with the same name is overwritten.
     */
    public Path dump(int tenantId, String label) {
        Tenant tenant = tenantRepository.getTenant(tenantId);
        String schema = SchemaNames.validate(tenant.getSchemaName());
        String suffix = StringUtils.isBlank(label) ? SnapshotNames.dailyLabel(clock.instant()) : label;
        Path target = snapshotStore.tenantDirectory(tenantId).resolve(SnapshotNames.fileName(schema, suffix));
        return dumpSchema(tenantId, schema, target);
    }

    /**
     * Takes today's snapshot unless it already exists, then applies retention.
     *
     * @return the new snapshot, or empty when today's snapshot was already present
     */
    public Optional<Path> ensureDailySnapshot(int tenantId) {
        Tenant tenant = tenantRepository.getTenant(tenantId);
        String schema = SchemaNames.validate(tenant.getSchemaName());
        String filename = SnapshotNames.fileName(schema, SnapshotNames.dailyLabel(clock.instant()));
        if (snapshotStore.exists(tenantId, filename)) {
            log.debug("Daily snapshot {} of tenant {} already exists", filename, tenantId);
            return Optional.empty();
        }
        Path created = dumpSchema(tenantId, schema, snapshotStore.tenantDirectory(tenantId).resolve(filename));
        snapshotStore.enforceRetention(tenantId);
        return Optional.of(created);
    }

    public SnapshotCreatedResponse createManualSnapshot(int tenantId) {
        Path created = dump(tenantId, SnapshotNames.timestampedLabel(SnapshotNames.MANUAL, clock.instant()));
        snapshotStore.enforceRetention(tenantId);
        return SnapshotCreatedResponse.builder()
                .tenantId(tenantId)
                .filename(created.getFileName().toString())
                .sizeBytes(sizeOf(created))
                .build();
    }

    /**
     * Uploads an existing local snapshot to object storage again.
     */
    public boolean mirrorSnapshot(int tenantId, String filename) {
        tenantRepository.getTenant(tenantId);
        Path snapshot = snapshotStore.findSnapshot(tenantId, filename);
        return mirror.upload(snapshotStore.tenantDirectoryName(tenantId), snapshot);
    }

    private Path dumpSchema(int tenantId, String schema, Path target) {
        log.info("Dumping schema {} of tenant {} to {}", schema, tenantId, target);
        long started = System.currentTimeMillis();
        ToolExecution execution;
        try (OutputStream out = new GZIPOutputStream(new BufferedOutputStream(Files.newOutputStream(target)))) {
            execution = pgClientTools.dumpSchema(schema, out);
        } catch (IOException e) {
            deletePartial(target);
            throw new SnapshotStorageException("cannot write snapshot " + target.getFileName(), e);
        }
        if (!execution.isSuccessful()) {
            deletePartial(target);
            log.error("pg_dump of schema {} for tenant {} failed with exit code {}: {}",
                    schema, tenantId, execution.getExitCode(), execution.getStderr());
            throw new DumpFailedException(schema, execution.getExitCode(), execution.getStderr());
        }
        log.info("Snapshot {} of tenant {} written in {} ms, {} bytes",
                target.getFileName(), tenantId, System.currentTimeMillis() - started, sizeOf(target));
        mirror.upload(snapshotStore.tenantDirectoryName(tenantId), target);
        return target;
    }

    private static void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Failed to delete partial snapshot {}: {}", target, e.getMessage());
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new SnapshotStorageException("cannot read size of " + file.getFileName(), e);
        }
    }
}

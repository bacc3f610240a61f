package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.epistula.backup.dto.BulkDeletionResult;
import org.epistula.backup.dto.DeletionResult;
import org.epistula.backup.dto.SnapshotInfo;
import org.epistula.backup.entity.SnapshotMetadata;
import org.epistula.backup.exceptions.ErrorCodeException;
import org.epistula.backup.exceptions.InvalidSnapshotNameException;
import org.epistula.backup.exceptions.SnapshotNotFoundException;
import org.epistula.backup.exceptions.SnapshotStorageException;
import org.epistula.backup.repositories.SnapshotMetadataRepository;
import org.epistula.backup.utils.SnapshotNames;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Per-tenant snapshot directories under the backups root. The file system is the source of truth:
 * metadata rows and mirrored copies only decorate what is found on disk.
 */
@Slf4j
@ApplicationScoped
public class SnapshotStore {

    private static final Comparator<SnapshotInfo> NEWEST_FIRST = Comparator
            .comparing(SnapshotInfo::getCreatedAt).reversed()
            .thenComparing(SnapshotInfo::getFilename, Comparator.reverseOrder());

    private final Path root;
    private final String directoryPrefix;
    private final int retention;
    private final SnapshotMirror mirror;
    private final SnapshotMetadataRepository metadataRepository;
    private final Clock clock;

    @Inject
    public SnapshotStore(@ConfigProperty(name = "epistula.backups.root", defaultValue = "/backups/database") String root,
                         @ConfigProperty(name = "epistula.backups.directory-prefix", defaultValue = "uni_") String directoryPrefix,
                         @ConfigProperty(name = "epistula.backups.retention", defaultValue = "30") int retention,
                         SnapshotMirror mirror,
                         SnapshotMetadataRepository metadataRepository,
                         Clock clock) {
        this(Paths.get(root), directoryPrefix, retention, mirror, metadataRepository, clock);
    }

    SnapshotStore(Path root, String directoryPrefix, int retention, SnapshotMirror mirror,
                  SnapshotMetadataRepository metadataRepository, Clock clock) {
        if (retention < 1) {
            throw new IllegalArgumentException("Snapshot retention must keep at least one file, got " + retention);
        }
        this.root = root;
        this.directoryPrefix = directoryPrefix;
        this.retention = retention;
        this.mirror = mirror;
        this.metadataRepository = metadataRepository;
        this.clock = clock;
    }

    public int getRetention() {
        return retention;
    }

    public String tenantDirectoryName(int tenantId) {
        return directoryPrefix + tenantId;
    }

    /**
     * The tenant directory, created on first use.
     */
    public Path tenantDirectory(int tenantId) {
        Path directory = root.resolve(tenantDirectoryName(tenantId));
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new SnapshotStorageException("cannot create snapshot directory " + directory, e);
        }
    }

    /**
     * Resolves an existing snapshot file, rejecting names that could leave the tenant directory.
     */
    public Path findSnapshot(int tenantId, String filename) {
        SnapshotNames.requireValid(filename);
        Path path = tenantDirectory(tenantId).resolve(filename);
        if (!SnapshotNames.hasSnapshotExtension(filename) || !Files.isRegularFile(path)) {
            throw new SnapshotNotFoundException(tenantId, filename);
        }
        return path;
    }

    public boolean exists(int tenantId, String filename) {
        return Files.isRegularFile(tenantDirectory(tenantId).resolve(SnapshotNames.requireValid(filename)));
    }

    /**
     * Snapshots of the tenant, newest first, decorated with metadata and mirror status.
     */
    public List<SnapshotInfo> listSnapshots(int tenantId) {
        List<SnapshotInfo> snapshots = listLocal(tenantId);
        if (snapshots.isEmpty()) {
            return snapshots;
        }
        Map<String, SnapshotMetadata> metadata = loadMetadata(tenantId);
        Set<String> mirrored = mirror.listMirrored(tenantDirectoryName(tenantId));
        for (SnapshotInfo snapshot : snapshots) {
            SnapshotMetadata meta = metadata.get(snapshot.getFilename());
            if (meta != null) {
                snapshot.setTitle(meta.getTitle());
                snapshot.setDescription(meta.getDescription());
            }
            snapshot.setMirrored(mirrored.contains(snapshot.getFilename()));
        }
        return snapshots;
    }

    public List<String> enforceRetention(int tenantId) {
        return enforceRetention(tenantId, retention);
    }

    /**
     * Keeps the newest {@code keep} local snapshots of the tenant and deletes the rest.
     * Mirrored copies are left in place.
     */
    public List<String> enforceRetention(int tenantId, int keep) {
        if (keep < 1) {
            throw new IllegalArgumentException("Snapshot retention must keep at least one file, got " + keep);
        }
        List<SnapshotInfo> snapshots = listLocal(tenantId);
        if (snapshots.size() <= keep) {
            return Collections.emptyList();
        }
        List<String> pruned = new ArrayList<>();
        for (SnapshotInfo snapshot : snapshots.subList(keep, snapshots.size())) {
            try {
                Files.deleteIfExists(snapshot.getPath());
                pruned.add(snapshot.getFilename());
            } catch (IOException e) {
                log.warn("Failed to prune old snapshot {}: {}", snapshot.getPath(), e.getMessage());
            }
        }
        log.info("Retention pruned {} snapshot(s) of tenant {}: {}", pruned.size(), tenantId, pruned);
        return pruned;
    }

    public DeletionResult deleteSnapshot(int tenantId, String filename, boolean alsoRemote) {
        SnapshotNames.requireValid(filename);
        if (!SnapshotNames.hasSnapshotExtension(filename)) {
            throw new InvalidSnapshotNameException(filename, "only " + SnapshotNames.EXTENSION + " snapshots can be deleted");
        }
        Path path = tenantDirectory(tenantId).resolve(filename);
        if (!Files.exists(path)) {
            throw new SnapshotNotFoundException(tenantId, filename);
        }
        DeletionResult.DeletionResultBuilder result = DeletionResult.builder().tenantId(tenantId).filename(filename);

        try {
            Files.delete(path);
            result.deletedLocal(true);
        } catch (NoSuchFileException e) {
            log.info("Snapshot {} disappeared before it could be deleted", path);
        } catch (IOException e) {
            log.warn("Failed to delete snapshot file {}: {}", path, e.getMessage());
        }

        if (alsoRemote && mirror.isEnabled()) {
            SnapshotMirror.MirrorResult remote = mirror.remove(tenantDirectoryName(tenantId), filename);
            result.remoteRequested(true).deletedRemote(remote.isSuccess()).remoteError(remote.getError());
        }

        try {
            metadataRepository.deleteByTenantAndFilename(tenantId, filename);
            result.deletedMetadata(true);
        } catch (PersistenceException e) {
            log.warn("Failed to delete metadata of snapshot {} for tenant {}: {}", filename, tenantId, e.getMessage());
        }

        DeletionResult deletion = result.build();
        log.info("Deleted snapshot {} of tenant {}: local={}, remote={}, metadata={}",
                filename, tenantId, deletion.isDeletedLocal(), deletion.isDeletedRemote(), deletion.isDeletedMetadata());
        return deletion;
    }

    /**
     * Deletes each named snapshot independently; a failure on one name does not stop the others.
     */
    public BulkDeletionResult deleteSnapshots(int tenantId, List<String> filenames, boolean alsoRemote) {
        List<DeletionResult> results = new ArrayList<>();
        for (String filename : filenames) {
            try {
                results.add(deleteSnapshot(tenantId, filename, alsoRemote));
            } catch (ErrorCodeException e) {
                log.warn("Skipping snapshot {} of tenant {}: {}", filename, tenantId, e.getDetail());
                results.add(DeletionResult.builder().tenantId(tenantId).filename(filename).error(e.getDetail()).build());
            }
        }
        int deleted = (int) results.stream().filter(DeletionResult::isDeletedLocal).count();
        return BulkDeletionResult.builder()
                .tenantId(tenantId)
                .requested(filenames.size())
                .deleted(deleted)
                .failed(filenames.size() - deleted)
                .results(results)
                .build();
    }

    public BulkDeletionResult deleteAllSnapshots(int tenantId, boolean alsoRemote) {
        List<String> filenames = listLocal(tenantId).stream().map(SnapshotInfo::getFilename).collect(Collectors.toList());
        log.info("Deleting all {} snapshot(s) of tenant {}", filenames.size(), tenantId);
        return deleteSnapshots(tenantId, filenames, alsoRemote);
    }

    /**
     * Moves the tenant directory aside as {@code <dir>_deleted_<timestamp>} so the snapshots outlive the tenant.
     */
    public Optional<Path> preserveTenantDirectory(int tenantId) {
        Path directory = root.resolve(tenantDirectoryName(tenantId));
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        Path preserved = root.resolve(directory.getFileName() + "_deleted_" + SnapshotNames.TIMESTAMP_FORMAT.format(clock.instant()));
        try {
            Files.move(directory, preserved);
        } catch (IOException e) {
            throw new SnapshotStorageException("cannot preserve snapshot directory " + directory, e);
        }
        log.info("Preserved snapshots of deleted tenant {} in {}", tenantId, preserved);
        return Optional.of(preserved);
    }

    /**
     * Removes the tenant directory with all its snapshots and, when asked, their mirrored copies.
     */
    public int purgeTenantDirectory(int tenantId, boolean alsoRemote) {
        Path directory = root.resolve(tenantDirectoryName(tenantId));
        int removed = 0;
        if (Files.isDirectory(directory)) {
            try (Stream<Path> files = Files.list(directory)) {
                for (Path file : files.collect(Collectors.toList())) {
                    Files.deleteIfExists(file);
                    removed++;
                }
                Files.deleteIfExists(directory);
            } catch (IOException e) {
                throw new SnapshotStorageException("cannot purge snapshot directory " + directory, e);
            }
        }
        if (alsoRemote) {
            int remote = mirror.purge(tenantDirectoryName(tenantId));
            log.info("Purged {} mirrored snapshot(s) of tenant {}", remote, tenantId);
        }
        log.info("Purged {} local file(s) of tenant {}", removed, tenantId);
        return removed;
    }

    private List<SnapshotInfo> listLocal(int tenantId) {
        Path directory = tenantDirectory(tenantId);
        List<SnapshotInfo> snapshots = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> SnapshotNames.hasSnapshotExtension(f.getFileName().toString()))
                    .collect(Collectors.toList())) {
                describe(file).ifPresent(snapshots::add);
            }
        } catch (IOException e) {
            throw new SnapshotStorageException("cannot list snapshot directory " + directory, e);
        }
        snapshots.sort(NEWEST_FIRST);
        return snapshots;
    }

    private Optional<SnapshotInfo> describe(Path file) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            if (!attributes.isRegularFile()) {
                return Optional.empty();
            }
            return Optional.of(SnapshotInfo.builder()
                    .filename(file.getFileName().toString())
                    .sizeBytes(attributes.size())
                    .createdAt(attributes.lastModifiedTime().toInstant())
                    .path(file)
                    .build());
        } catch (NoSuchFileException e) {
            // removed while listing
            return Optional.empty();
        } catch (IOException e) {
            throw new SnapshotStorageException("cannot read attributes of " + file, e);
        }
    }

    private Map<String, SnapshotMetadata> loadMetadata(int tenantId) {
        try {
            return metadataRepository.findByTenant(tenantId).stream()
                    .collect(Collectors.toMap(SnapshotMetadata::getFilename, Function.identity(), (a, b) -> a));
        } catch (PersistenceException e) {
            log.warn("Snapshot metadata of tenant {} is unavailable: {}", tenantId, e.getMessage());
            return Collections.emptyMap();
        }
    }
}

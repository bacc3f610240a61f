package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import net.jodah.failsafe.Failsafe;
import net.jodah.failsafe.FailsafeException;
import net.jodah.failsafe.RetryPolicy;
import org.epistula.backup.storage.ObjectStorage;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Copies snapshots to the object store under {@code <bucket>/<tenant directory>/<file>}.
 * Mirroring never fails the caller: problems are logged and reported through the return values.
 */
@Slf4j
@ApplicationScoped
public class SnapshotMirror {

    private final ObjectStorage objectStorage;
    private final boolean enabled;
    private final String bucket;
    private final int retryAttempts;
    private final Duration retryDelay;
    private final AtomicBoolean bucketReady = new AtomicBoolean();

    public SnapshotMirror(ObjectStorage objectStorage,
                          @ConfigProperty(name = "epistula.backups.mirror.enabled", defaultValue = "true") boolean enabled,
                          @ConfigProperty(name = "epistula.backups.mirror.bucket", defaultValue = "backups") String bucket,
                          @ConfigProperty(name = "epistula.backups.mirror.retry.attempts", defaultValue = "2") int retryAttempts,
                          @ConfigProperty(name = "epistula.backups.mirror.retry.delay", defaultValue = "PT1S") Duration retryDelay) {
        this.objectStorage = objectStorage;
        this.enabled = enabled;
        this.bucket = bucket;
        this.retryAttempts = retryAttempts;
        this.retryDelay = retryDelay;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean upload(String tenantDirectory, Path file) {
        if (!enabled) {
            log.debug("Object storage mirroring is disabled, {} stays local only", file.getFileName());
            return false;
        }
        String key = key(tenantDirectory, file.getFileName().toString());
        try {
            Failsafe.with(buildRetryPolicy(key, "upload")).run(() -> {
                ensureBucket();
                objectStorage.put(bucket, key, file);
            });
            log.info("Mirrored snapshot to {}/{}", bucket, key);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to mirror snapshot {} to object storage: {}", key, rootMessage(e));
            return false;
        }
    }

    public MirrorResult remove(String tenantDirectory, String filename) {
        if (!enabled) {
            return MirrorResult.skipped();
        }
        String key = key(tenantDirectory, filename);
        try {
            Failsafe.with(buildRetryPolicy(key, "remove")).run(() -> objectStorage.remove(bucket, key));
            log.info("Removed mirrored snapshot {}/{}", bucket, key);
            return MirrorResult.success();
        } catch (RuntimeException e) {
            String message = rootMessage(e);
            log.warn("Failed to remove mirrored snapshot {}: {}", key, message);
            return MirrorResult.failure(message);
        }
    }

    /**
     * Filenames mirrored for the tenant directory, or an empty set when the store cannot be reached.
     */
    public Set<String> listMirrored(String tenantDirectory) {
        if (!enabled) {
            return Collections.emptySet();
        }
        String prefix = tenantDirectory + "/";
        try {
            List<String> keys = Failsafe.with(buildRetryPolicy(prefix, "list")).get(() -> objectStorage.list(bucket, prefix));
            Set<String> filenames = new LinkedHashSet<>();
            for (String key : keys) {
                filenames.add(key.substring(prefix.length()));
            }
            return filenames;
        } catch (RuntimeException e) {
            log.warn("Failed to list mirrored snapshots under {}: {}", prefix, rootMessage(e));
            return Collections.emptySet();
        }
    }

    /**
     * Removes every mirrored snapshot of the tenant directory and returns how many were removed.
     */
    public int purge(String tenantDirectory) {
        int removed = 0;
        for (String filename : listMirrored(tenantDirectory)) {
            if (remove(tenantDirectory, filename).isSuccess()) {
                removed++;
            }
        }
        return removed;
    }

    static String key(String tenantDirectory, String filename) {
        return tenantDirectory + "/" + filename;
    }

    private void ensureBucket() {
        if (!bucketReady.get()) {
            objectStorage.ensureBucket(bucket);
            bucketReady.set(true);
        }
    }

    private RetryPolicy<Object> buildRetryPolicy(String key, String operation) {
        return new RetryPolicy<>()
                .handle(RuntimeException.class)
                .withMaxRetries(retryAttempts)
                .withDelay(retryDelay)
                .onFailedAttempt(e -> log.warn("Object storage {} attempt failed for {}: {}",
                        operation, key, e.getLastFailure().getMessage()))
                .onRetry(e -> log.info("Retrying object storage {} for {}...", operation, key))
                .onFailure(e -> log.error("Object storage {} gave up for {}", operation, key));
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e instanceof FailsafeException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Value
    public static class MirrorResult {
        boolean attempted;
        boolean success;
        String error;

        static MirrorResult skipped() {
            return new MirrorResult(false, false, null);
        }

        static MirrorResult success() {
            return new MirrorResult(true, true, null);
        }

        static MirrorResult failure(String error) {
            return new MirrorResult(true, false, error);
        }
    }
}

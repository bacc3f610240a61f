package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.epistula.backup.exceptions.OperationAlreadyRunningException;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Serializes restore, promote, discard and tenant deletion per tenant across all service instances.
 * A second caller fails immediately instead of waiting.
 */
@Slf4j
@ApplicationScoped
public class TenantOperationLock {

    static final String LOCK_PREFIX = "schema-lifecycle-";

    private final LockProvider lockProvider;
    private final Duration lockAtMostFor;

    public TenantOperationLock(LockProvider lockProvider,
                               @ConfigProperty(name = "epistula.backups.lock.max-duration", defaultValue = "PT30M") Duration lockAtMostFor) {
        this.lockProvider = lockProvider;
        this.lockAtMostFor = lockAtMostFor;
    }

    public <T> T callWithLock(int tenantId, String operation, Supplier<T> action) {
        LockConfiguration configuration = new LockConfiguration(Instant.now(), LOCK_PREFIX + tenantId, lockAtMostFor, Duration.ZERO);
        Optional<SimpleLock> lock = lockProvider.lock(configuration);
        if (lock.isEmpty()) {
            log.warn("Rejecting '{}' for tenant {}: another lifecycle operation holds the lock", operation, tenantId);
            throw new OperationAlreadyRunningException(operation, tenantId);
        }
        log.debug("Acquired lifecycle lock of tenant {} for '{}'", tenantId, operation);
        try {
            return action.get();
        } finally {
            lock.get().unlock();
            log.debug("Released lifecycle lock of tenant {}", tenantId);
        }
    }
}

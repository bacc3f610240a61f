package org.epistula.backup.service;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.DefaultLockingTaskExecutor;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.epistula.backup.entity.Tenant;
import org.epistula.backup.repositories.TenantRepository;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Periodically makes sure every active tenant has today's snapshot. Only one service instance runs a batch
 * at a time and a failing tenant does not stop the others.
 */
@Slf4j
@ApplicationScoped
public class DailySnapshotScheduler {

    static final String JOB_ID = "daily-tenant-snapshots";
    static final String BATCH_LOCK = "daily-snapshots";

    private final Scheduler scheduler;
    private final TenantRepository tenantRepository;
    private final SchemaDumpService dumpService;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final boolean enabled;
    private final String initialDelay;
    private final String interval;
    private final Duration batchLockAtMostFor;

    public DailySnapshotScheduler(Scheduler scheduler,
                                  TenantRepository tenantRepository,
                                  SchemaDumpService dumpService,
                                  LockProvider lockProvider,
                                  @ConfigProperty(name = "epistula.backups.scheduler.enabled", defaultValue = "true") boolean enabled,
                                  @ConfigProperty(name = "epistula.backups.scheduler.initial-delay", defaultValue = "5s") String initialDelay,
                                  @ConfigProperty(name = "epistula.backups.scheduler.interval", defaultValue = "1h") String interval,
                                  @ConfigProperty(name = "epistula.backups.lock.max-duration", defaultValue = "PT30M") Duration batchLockAtMostFor) {
        this.scheduler = scheduler;
        this.tenantRepository = tenantRepository;
        this.dumpService = dumpService;
        this.lockingTaskExecutor = new DefaultLockingTaskExecutor(lockProvider);
        this.enabled = enabled;
        this.initialDelay = initialDelay;
        this.interval = interval;
        this.batchLockAtMostFor = batchLockAtMostFor;
    }

    void onStart(@Observes StartupEvent event) {
        if (enabled) {
            start();
        } else {
            log.info("Daily snapshot scheduler is disabled");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Starts the periodic job; a second call while it is scheduled does nothing.
     *
     * @return whether this call started the job
     */
    public synchronized boolean start() {
        if (isRunning()) {
            log.debug("Daily snapshot job is already scheduled");
            return false;
        }
        scheduler.newJob(JOB_ID)
                .setDelayed(initialDelay)
                .setInterval(interval)
                .setConcurrentExecution(Scheduled.ConcurrentExecution.SKIP)
                .setTask(execution -> runBatchLocked())
                .schedule();
        log.info("Daily snapshot job scheduled, first run in {}, then every {}", initialDelay, interval);
        return true;
    }

    public synchronized boolean stop() {
        if (scheduler.unscheduleJob(JOB_ID) == null) {
            return false;
        }
        log.info("Daily snapshot job stopped");
        return true;
    }

    public boolean isRunning() {
        return scheduler.getScheduledJob(JOB_ID) != null;
    }

    void runBatchLocked() {
        try {
            lockingTaskExecutor.executeWithLock((Runnable) this::runBatch,
                    new LockConfiguration(Instant.now(), BATCH_LOCK, batchLockAtMostFor, Duration.ZERO));
        } catch (RuntimeException e) {
            log.error("Daily snapshot batch failed", e);
        }
    }

    /**
     * Ensures today's snapshot for each active tenant.
     *
     * @return the number of snapshots created
     */
    public int runBatch() {
        List<Tenant> tenants = tenantRepository.listActive();
        log.info("Daily snapshot batch started for {} tenant(s)", tenants.size());
        int created = 0;
        int failed = 0;
        for (Tenant tenant : tenants) {
            try {
                Optional<Path> snapshot = dumpService.ensureDailySnapshot(tenant.getId());
                if (snapshot.isPresent()) {
                    created++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Daily snapshot of tenant {} ({}) failed: {}", tenant.getId(), tenant.getSchemaName(), e.getMessage(), e);
            }
        }
        log.info("Daily snapshot batch finished: {} created, {} already present, {} failed",
                created, tenants.size() - created - failed, failed);
        return created;
    }
}

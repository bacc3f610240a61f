package org.epistula.backup.service;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.epistula.backup.dto.LifecycleState;
import org.epistula.backup.dto.RestoreResult;
import org.epistula.backup.entity.Tenant;
import org.epistula.backup.exceptions.OperationAlreadyRunningException;
import org.epistula.backup.exceptions.RestoreFailedException;
import org.epistula.backup.exceptions.RestoreTimeoutException;
import org.epistula.backup.exceptions.SnapshotNotFoundException;
import org.epistula.backup.repositories.SchemaCatalogRepository;
import org.epistula.backup.repositories.SnapshotMetadataRepository;
import org.epistula.backup.repositories.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchemaRestoreServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(300);
    private static final String SNAPSHOT = "uni_5_20240430.sql.gz";
    private static final String DUMP = "CREATE SCHEMA uni_5;\n"
            + "CREATE TABLE uni_5.users (id integer);\n"
            + "ALTER TABLE ONLY \"uni_5\".users ADD PRIMARY KEY (id);\n";

    @TempDir
    Path root;

    @Mock
    TenantRepository tenantRepository;

    @Mock
    SchemaCatalogRepository schemaCatalogRepository;

    @Mock
    TenantCatalogService tenantCatalogService;

    @Mock
    SchemaDumpService dumpService;

    @Mock
    PgClientTools pgClientTools;

    @Mock
    SnapshotMirror mirror;

    @Mock
    SnapshotMetadataRepository metadataRepository;

    @Mock
    LockProvider lockProvider;

    @Mock
    SimpleLock simpleLock;

    private final Tenant tenant = Tenant.builder().id(5).name("Northern University").code("NU").schemaName("uni_5").active(true).build();
    private final AtomicReference<String> executedScript = new AtomicReference<>();
    private SnapshotStore snapshotStore;
    private SchemaRestoreService restoreService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        snapshotStore = new SnapshotStore(root, "uni_", 30, mirror, metadataRepository, clock);
        restoreService = new SchemaRestoreService(tenantRepository, schemaCatalogRepository, tenantCatalogService,
                snapshotStore, dumpService, pgClientTools, new TenantOperationLock(lockProvider, Duration.ofMinutes(30)),
                clock, TIMEOUT);
    }

    @Test
    void restoreToTempRewritesSchemaAndRegistersWorkspace() throws Exception {
        givenLockFree();
        givenTenantWithSnapshot();
        givenPsqlExits(0);
        when(tenantCatalogService.registerTempWorkspace(tenant)).thenReturn(Tenant.builder().id(42).build());

        RestoreResult result = restoreService.restore(5, SNAPSHOT, true);

        assertEquals("uni_5_temp", result.getTargetSchema());
        assertEquals(42, result.getTempTenantId());
        assertEquals(LifecycleState.VALIDATING, result.getState());
        assertNull(result.getSafetySnapshot());
        assertEquals("CREATE SCHEMA uni_5_temp;\n"
                + "CREATE TABLE uni_5_temp.users (id integer);\n"
                + "ALTER TABLE ONLY \"uni_5_temp\".users ADD PRIMARY KEY (id);\n", executedScript.get());
        InOrder inOrder = inOrder(schemaCatalogRepository, pgClientTools, tenantCatalogService);
        inOrder.verify(schemaCatalogRepository).recreateSchema("uni_5_temp");
        inOrder.verify(pgClientTools).executeSql(any(), eq(TIMEOUT));
        inOrder.verify(tenantCatalogService).registerTempWorkspace(tenant);
        verify(schemaCatalogRepository, never()).recreateSchema("uni_5");
        verifyNoInteractions(dumpService);
        verify(simpleLock).unlock();
    }

    @Test
    void restoreToProductionTakesSafetySnapshotFirst() throws Exception {
        givenLockFree();
        givenTenantWithSnapshot();
        givenPsqlExits(0);
        when(dumpService.dump(5, "prerestore_20240501_101530"))
                .thenReturn(root.resolve("uni_5/uni_5_prerestore_20240501_101530.sql.gz"));

        RestoreResult result = restoreService.restore(5, SNAPSHOT, false);

        assertEquals("uni_5", result.getTargetSchema());
        assertEquals("uni_5_prerestore_20240501_101530.sql.gz", result.getSafetySnapshot());
        assertNull(result.getTempTenantId());
        assertEquals(DUMP, executedScript.get());
        InOrder inOrder = inOrder(dumpService, schemaCatalogRepository, pgClientTools);
        inOrder.verify(dumpService).dump(5, "prerestore_20240501_101530");
        inOrder.verify(schemaCatalogRepository).recreateSchema("uni_5");
        inOrder.verify(pgClientTools).executeSql(any(), eq(TIMEOUT));
        verifyNoInteractions(tenantCatalogService);
    }

    @Test
    void missingSnapshotTouchesNothing() {
        givenLockFree();
        when(tenantRepository.getTenant(5)).thenReturn(tenant);

        assertThrows(SnapshotNotFoundException.class, () -> restoreService.restore(5, "uni_5_19990101.sql.gz", true));

        verifyNoInteractions(schemaCatalogRepository, pgClientTools, dumpService);
        verify(simpleLock).unlock();
    }

    @Test
    void failedPsqlDoesNotRegisterWorkspace() throws Exception {
        givenLockFree();
        givenTenantWithSnapshot();
        givenPsqlExits(2);

        RestoreFailedException e = assertThrows(RestoreFailedException.class, () -> restoreService.restore(5, SNAPSHOT, true));

        assertEquals(2, e.getExitCode());
        verify(tenantCatalogService, never()).registerTempWorkspace(any());
    }

    @Test
    void timeoutIsReported() throws Exception {
        givenLockFree();
        givenTenantWithSnapshot();
        when(pgClientTools.executeSql(any(), eq(TIMEOUT))).thenThrow(new TimeoutException("psql killed"));

        RestoreTimeoutException e = assertThrows(RestoreTimeoutException.class, () -> restoreService.restore(5, SNAPSHOT, true));

        assertEquals("uni_5_temp", e.getSchema());
        verify(simpleLock).unlock();
    }

    @Test
    void concurrentLifecycleOperationIsRejected() {
        when(lockProvider.lock(any())).thenReturn(Optional.empty());

        assertThrows(OperationAlreadyRunningException.class, () -> restoreService.restore(5, SNAPSHOT, true));

        verifyNoInteractions(tenantRepository, schemaCatalogRepository, pgClientTools);
    }

    @Test
    void failedRegistrationDropsRestoredSchema() throws Exception {
        givenLockFree();
        givenTenantWithSnapshot();
        givenPsqlExits(0);
        IllegalStateException failure = new IllegalStateException("duplicate code");
        when(tenantCatalogService.registerTempWorkspace(tenant)).thenThrow(failure);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> restoreService.restore(5, SNAPSHOT, true));

        assertSame(failure, e);
        verify(tenantCatalogService).destroyTempWorkspace(tenant);
    }

    @Test
    void restoringOldestSnapshotOfFullRetentionWindowReadsItBeforePruning() throws Exception {
        SchemaRestoreService service = restoreServiceKeeping(2);
        givenLockFree();
        givenTenantWithSnapshot();
        Path directory = snapshotStore.tenantDirectory(5);
        Files.setLastModifiedTime(directory.resolve(SNAPSHOT), FileTime.from(NOW.minusSeconds(86_400)));
        writeSnapshot(directory.resolve("uni_5_20240501.sql.gz"), NOW.minusSeconds(3_600));
        Path safety = directory.resolve("uni_5_prerestore_20240501_101530.sql.gz");
        when(dumpService.dump(5, "prerestore_20240501_101530")).thenAnswer(invocation -> {
            writeSnapshot(safety, NOW);
            return safety;
        });
        givenPsqlExits(0);

        RestoreResult result = service.restore(5, SNAPSHOT, false);

        assertEquals(DUMP, executedScript.get());
        assertEquals("uni_5_prerestore_20240501_101530.sql.gz", result.getSafetySnapshot());
        assertFalse(Files.exists(directory.resolve(SNAPSHOT)));
        assertTrue(Files.exists(directory.resolve("uni_5_20240501.sql.gz")));
        assertTrue(Files.exists(safety));
    }

    @Test
    void failedProductionRestoreKeepsEverySnapshot() throws Exception {
        SchemaRestoreService service = restoreServiceKeeping(1);
        givenLockFree();
        givenTenantWithSnapshot();
        Path directory = snapshotStore.tenantDirectory(5);
        Files.setLastModifiedTime(directory.resolve(SNAPSHOT), FileTime.from(NOW.minusSeconds(86_400)));
        Path safety = directory.resolve("uni_5_prerestore_20240501_101530.sql.gz");
        when(dumpService.dump(5, "prerestore_20240501_101530")).thenAnswer(invocation -> {
            writeSnapshot(safety, NOW);
            return safety;
        });
        givenPsqlExits(3);

        assertThrows(RestoreFailedException.class, () -> service.restore(5, SNAPSHOT, false));

        assertTrue(Files.exists(directory.resolve(SNAPSHOT)));
        assertTrue(Files.exists(safety));
    }

    private SchemaRestoreService restoreServiceKeeping(int retention) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        snapshotStore = new SnapshotStore(root, "uni_", retention, mirror, metadataRepository, clock);
        return new SchemaRestoreService(tenantRepository, schemaCatalogRepository, tenantCatalogService,
                snapshotStore, dumpService, pgClientTools, new TenantOperationLock(lockProvider, Duration.ofMinutes(30)),
                clock, TIMEOUT);
    }

    private static void writeSnapshot(Path file, Instant modified) throws IOException {
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write(DUMP.getBytes(StandardCharsets.UTF_8));
        }
        Files.setLastModifiedTime(file, FileTime.from(modified));
    }

    private void givenLockFree() {
        when(lockProvider.lock(any())).thenReturn(Optional.of(simpleLock));
    }

    private void givenTenantWithSnapshot() throws IOException {
        when(tenantRepository.getTenant(5)).thenReturn(tenant);
        Path file = snapshotStore.tenantDirectory(5).resolve(SNAPSHOT);
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write(DUMP.getBytes(StandardCharsets.UTF_8));
        }
    }

    private void givenPsqlExits(int exitCode) throws Exception {
        when(pgClientTools.executeSql(any(), eq(TIMEOUT))).thenAnswer(invocation -> {
            try (InputStream script = invocation.getArgument(0)) {
                executedScript.set(new String(script.readAllBytes(), StandardCharsets.UTF_8));
            }
            return new ToolExecution("psql", exitCode, exitCode == 0 ? "" : "ERROR: syntax error");
        });
    }
}

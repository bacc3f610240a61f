package org.epistula.backup.service;

import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.epistula.backup.exceptions.OperationAlreadyRunningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TenantOperationLockTest {

    @Mock
    LockProvider lockProvider;

    @Mock
    SimpleLock simpleLock;

    private TenantOperationLock operationLock;

    @BeforeEach
    void setUp() {
        operationLock = new TenantOperationLock(lockProvider, Duration.ofMinutes(30));
    }

    @Test
    void runsActionUnderTenantLock() {
        when(lockProvider.lock(any())).thenReturn(Optional.of(simpleLock));

        assertEquals("done", operationLock.callWithLock(5, "promote", () -> "done"));

        ArgumentCaptor<LockConfiguration> captor = ArgumentCaptor.forClass(LockConfiguration.class);
        verify(lockProvider).lock(captor.capture());
        assertEquals("schema-lifecycle-5", captor.getValue().getName());
        assertEquals(Duration.ofMinutes(30), captor.getValue().getLockAtMostFor());
        verify(simpleLock).unlock();
    }

    @Test
    void failsFastWhenLockIsHeld() {
        when(lockProvider.lock(any())).thenReturn(Optional.empty());
        AtomicBoolean ran = new AtomicBoolean();

        OperationAlreadyRunningException e = assertThrows(OperationAlreadyRunningException.class,
                () -> operationLock.callWithLock(5, "restore", () -> {
                    ran.set(true);
                    return null;
                }));

        assertFalse(ran.get());
        assertEquals(409, e.getStatus());
    }

    @Test
    void releasesLockWhenActionFails() {
        when(lockProvider.lock(any())).thenReturn(Optional.of(simpleLock));

        assertThrows(IllegalStateException.class, () -> operationLock.callWithLock(5, "discard temp", () -> {
            throw new IllegalStateException("boom");
        }));

        verify(simpleLock).unlock();
    }
}

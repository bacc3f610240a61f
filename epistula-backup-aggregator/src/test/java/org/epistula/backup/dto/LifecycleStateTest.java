package org.epistula.backup.dto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleStateTest {

    @Test
    void promotionRequiresValidatingState() {
        assertTrue(LifecycleState.VALIDATING.canTransitionTo(LifecycleState.PROMOTED));
        assertFalse(LifecycleState.PRODUCTION_ONLY.canTransitionTo(LifecycleState.PROMOTED));
    }

    @Test
    void discardIsAllowedFromEitherStableState() {
        assertTrue(LifecycleState.VALIDATING.canTransitionTo(LifecycleState.DISCARDED));
        assertTrue(LifecycleState.PRODUCTION_ONLY.canTransitionTo(LifecycleState.DISCARDED));
    }

    @Test
    void transitionalStatesSettleIntoProductionOnly() {
        assertEquals(LifecycleState.PRODUCTION_ONLY, LifecycleState.of(false));
        assertEquals(LifecycleState.VALIDATING, LifecycleState.of(true));
        assertTrue(LifecycleState.PROMOTED.canTransitionTo(LifecycleState.PRODUCTION_ONLY));
        assertFalse(LifecycleState.DISCARDED.canTransitionTo(LifecycleState.VALIDATING));
    }
}

package org.epistula.backup.dto;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a tenant's schema pair. {@link #PROMOTED} and {@link #DISCARDED} are reported by the transitions
 * that produce them and settle back into {@link #PRODUCTION_ONLY}.
 */
public enum LifecycleState {
    PRODUCTION_ONLY,
    VALIDATING,
    PROMOTED,
    DISCARDED;

    public Set<LifecycleState> allowedTransitions() {
        switch (this) {
            case PRODUCTION_ONLY:
                return EnumSet.of(VALIDATING, DISCARDED);
            case VALIDATING:
                return EnumSet.of(VALIDATING, PROMOTED, DISCARDED);
            default:
                return EnumSet.of(PRODUCTION_ONLY);
        }
    }

    public boolean canTransitionTo(LifecycleState target) {
        return allowedTransitions().contains(target);
    }

    public static LifecycleState of(boolean tempSchemaExists) {
        return tempSchemaExists ? VALIDATING : PRODUCTION_ONLY;
    }
}

package io.stsguard.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Orchestrator state machine. Once a destructive phase has been entered the run can only end
 * in {@link #SUCCEEDED} or {@link #DEGRADED}.
 */
public enum Phase {
    IDLE(false),
    DIFFING(false),
    FAST_APPLYING(false),
    BACKING_UP(false),
    SCALING_DOWN(true),
    DELETING(true),
    RECREATING(true),
    RESTORING(true),
    VERIFYING(false),
    SUCCEEDED(false),
    DEGRADED(false),
    FAILED(false);

    private static final Map<Phase, Set<Phase>> ALLOWED_TRANSITIONS = Map.ofEntries(
            Map.entry(IDLE, EnumSet.of(DIFFING, FAILED)),
            Map.entry(DIFFING, EnumSet.of(FAST_APPLYING, BACKING_UP, SCALING_DOWN, FAILED)),
            Map.entry(FAST_APPLYING, EnumSet.of(VERIFYING, BACKING_UP, SCALING_DOWN, FAILED)),
            Map.entry(BACKING_UP, EnumSet.of(SCALING_DOWN, FAILED)),
            Map.entry(SCALING_DOWN, EnumSet.of(DELETING, DEGRADED)),
            Map.entry(DELETING, EnumSet.of(RECREATING, DEGRADED)),
            Map.entry(RECREATING, EnumSet.of(RESTORING, VERIFYING, DEGRADED)),
            Map.entry(RESTORING, EnumSet.of(VERIFYING, DEGRADED)),
            Map.entry(VERIFYING, EnumSet.of(SUCCEEDED, DEGRADED)),
            Map.entry(SUCCEEDED, EnumSet.noneOf(Phase.class)),
            Map.entry(DEGRADED, EnumSet.noneOf(Phase.class)),
            Map.entry(FAILED, EnumSet.noneOf(Phase.class))
    );

    private final boolean destructive;

    Phase(boolean destructive) {
        this.destructive = destructive;
    }

    public boolean destructive() {
        return destructive;
    }

    public boolean terminal() {
        return this == SUCCEEDED || this == DEGRADED || this == FAILED;
    }

    public boolean canTransitionTo(Phase next) {
        return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(next);
    }
}

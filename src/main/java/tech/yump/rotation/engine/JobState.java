package tech.yump.rotation.engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a rotation job. Transitions only move forward through the graph; failure exits
 * (FAILED, ROLLED_BACK) are reachable from HEALTH_CHECK onward, CANCELLED up to VALIDATING.
 */
public enum JobState {
    PENDING,
    HEALTH_CHECK,
    APPROVAL_WAIT,
    GENERATING,
    DISTRIBUTING,
    VALIDATING,
    ACTIVATING,
    CLEANUP,
    COMPLETED,
    FAILED,
    ROLLED_BACK,
    CANCELLED;

    private static final Set<JobState> TERMINAL = EnumSet.of(COMPLETED, FAILED, ROLLED_BACK, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Cancellation is allowed until activation starts.
     */
    public boolean isCancellable() {
        return ordinal() <= VALIDATING.ordinal();
    }

    public boolean canTransitionTo(JobState target) {
        if (isTerminal()) {
            return false;
        }
        if (target == CANCELLED) {
            return isCancellable();
        }
        if (target == FAILED || target == ROLLED_BACK) {
            return this != PENDING;
        }
        return switch (this) {
            case PENDING -> target == HEALTH_CHECK;
            case HEALTH_CHECK -> target == APPROVAL_WAIT || target == GENERATING;
            case APPROVAL_WAIT -> target == GENERATING;
            case GENERATING -> target == DISTRIBUTING;
            case DISTRIBUTING -> target == VALIDATING;
            case VALIDATING -> target == ACTIVATING;
            case ACTIVATING -> target == CLEANUP;
            case CLEANUP -> target == COMPLETED;
            default -> false;
        };
    }
}

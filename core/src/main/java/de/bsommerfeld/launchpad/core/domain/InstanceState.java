package de.bsommerfeld.launchpad.core.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a launched instance.
 *
 * <p>
 * States only move forward towards the two sinks {@link #TERMINATED} and
 * {@link #ERROR}. The only way back is the recovery path out of
 * {@link #NOT_RESPONDING}, and the focus toggle between {@link #ACTIVE} and
 * {@link #INACTIVE}.
 */
public enum InstanceState {

    STARTING,
    RUNNING,
    ACTIVE,
    INACTIVE,
    NOT_RESPONDING,
    TERMINATED,
    ERROR;

    public boolean isTerminal() {
        return this == TERMINATED || this == ERROR;
    }

    /**
     * @return {@code true} while the instance owns live OS artifacts
     */
    public boolean isAlive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(InstanceState target) {
        return allowedTargets().contains(target);
    }

    private Set<InstanceState> allowedTargets() {
        switch (this) {
            case STARTING:
                return EnumSet.of(RUNNING, TERMINATED, ERROR);
            case RUNNING:
                return EnumSet.of(ACTIVE, INACTIVE, NOT_RESPONDING, TERMINATED, ERROR);
            case ACTIVE:
                return EnumSet.of(INACTIVE, NOT_RESPONDING, TERMINATED, ERROR);
            case INACTIVE:
                return EnumSet.of(ACTIVE, NOT_RESPONDING, TERMINATED, ERROR);
            case NOT_RESPONDING:
                return EnumSet.of(RUNNING, ACTIVE, INACTIVE, TERMINATED, ERROR);
            default:
                return EnumSet.noneOf(InstanceState.class);
        }
    }
}

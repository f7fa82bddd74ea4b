package org.cognita.actor;

import java.util.EnumSet;
import java.util.Set;

/**
 * The lifecycle states of an actor.
 * <pre>
 * PENDING -> STARTING -> RUNNING <-> PAUSED -> STOPPING -> STOPPED
 *                        RUNNING | PAUSED -> ERROR
 * </pre>
 */
public enum ActorStatus {
    PENDING,
    STARTING,
    RUNNING,
    PAUSED,
    STOPPING,
    STOPPED,
    ERROR;

    /**
     * Checks whether a transition is allowed.
     */
    public boolean canTransitionTo(ActorStatus next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == STOPPED || this == ERROR;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    private Set<ActorStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(STARTING, STOPPED);
            case STARTING -> EnumSet.of(RUNNING, STOPPING, ERROR);
            case RUNNING -> EnumSet.of(PAUSED, STOPPING, ERROR);
            case PAUSED -> EnumSet.of(RUNNING, STOPPING, ERROR);
            case STOPPING -> EnumSet.of(STOPPED, ERROR);
            case STOPPED, ERROR -> EnumSet.noneOf(ActorStatus.class);
        };
    }
}

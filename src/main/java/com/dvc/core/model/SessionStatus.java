package com.dvc.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a challenge session.
 *
 * <pre>
 * STARTING -> RUNNING -> STOPPING -> STOPPED
 *     |          |
 *     +----------+-----> ERROR
 * </pre>
 *
 * STARTING may also move straight to STOPPING when the user stops a session
 * whose container is still being provisioned. A session whose container
 * failed its health checks goes RUNNING -> STOPPING -> ERROR, keeping its
 * slot until the container is removed.
 */
public enum SessionStatus {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    ERROR;

    public boolean isTerminal() {
        return this == STOPPED || this == ERROR;
    }

    public boolean canTransitionTo(SessionStatus next) {
        return allowedNext().contains(next);
    }

    private Set<SessionStatus> allowedNext() {
        return switch (this) {
            case STARTING -> EnumSet.of(RUNNING, STOPPING, ERROR);
            case RUNNING -> EnumSet.of(STOPPING, ERROR);
            case STOPPING -> EnumSet.of(STOPPED, ERROR);
            case STOPPED, ERROR -> EnumSet.noneOf(SessionStatus.class);
        };
    }
}

package com.dvc.core.orchestrator;

/**
 * What triggered a container teardown.
 */
public enum TeardownReason {
    USER_STOP("user_stop"),
    COMPLETED("completed"),
    EXPIRED("expired"),
    HEALTH_FAILURE("health_failure"),
    STOPPED_WHILE_STARTING("stopped_while_starting"),
    SHUTDOWN("shutdown"),
    RETRY("retry");

    private final String tag;

    TeardownReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

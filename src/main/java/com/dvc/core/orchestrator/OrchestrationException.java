package com.dvc.core.orchestrator;

/**
 * Base of every error the orchestrator reports to its callers.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorKind kind;

    public OrchestrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OrchestrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}

package com.dvc.core.orchestrator;

/**
 * The user already has an active session for the challenge.
 */
public class DuplicateSessionException extends OrchestrationException {

    public DuplicateSessionException(String message) {
        super(ErrorKind.DUPLICATE_SESSION, message);
    }
}

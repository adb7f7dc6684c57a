package com.dvc.core.orchestrator;

/**
 * The session does not exist or is in the wrong state.
 */
public class InvalidSessionException extends OrchestrationException {

    public InvalidSessionException(String message) {
        super(ErrorKind.INVALID_SESSION, message);
    }
}

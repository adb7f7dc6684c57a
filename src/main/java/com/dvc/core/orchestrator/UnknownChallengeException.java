package com.dvc.core.orchestrator;

/**
 * The challenge id is not in the catalog.
 */
public class UnknownChallengeException extends OrchestrationException {

    public UnknownChallengeException(String message) {
        super(ErrorKind.UNKNOWN_CHALLENGE, message);
    }
}

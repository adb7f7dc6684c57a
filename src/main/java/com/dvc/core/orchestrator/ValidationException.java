package com.dvc.core.orchestrator;

/**
 * Malformed caller input.
 */
public class ValidationException extends OrchestrationException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}

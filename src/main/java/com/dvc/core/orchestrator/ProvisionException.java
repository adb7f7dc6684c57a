package com.dvc.core.orchestrator;

/**
 * The container engine could not create or start the challenge container.
 */
public class ProvisionException extends OrchestrationException {

    public ProvisionException(String message) {
        super(ErrorKind.PROVISION_FAILED, message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(ErrorKind.PROVISION_FAILED, message, cause);
    }
}

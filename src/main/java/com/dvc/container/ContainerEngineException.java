package com.dvc.container;

/**
 * A container engine call failed.
 */
public class ContainerEngineException extends RuntimeException {

    public ContainerEngineException(String message) {
        super(message);
    }

    public ContainerEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

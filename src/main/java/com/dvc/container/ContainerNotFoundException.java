package com.dvc.container;

/**
 * The engine no longer knows the container.
 */
public class ContainerNotFoundException extends ContainerEngineException {

    public ContainerNotFoundException(String containerId, Throwable cause) {
        super("Container " + containerId + " not found", cause);
    }
}

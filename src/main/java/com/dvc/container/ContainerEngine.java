package com.dvc.container;

import java.util.List;

/**
 * Port to the container runtime that hosts challenge containers.
 *
 * <p>All methods block and may be slow; callers run them off request and
 * lock-holding threads. Failures surface as {@link ContainerEngineException},
 * and as {@link ContainerNotFoundException} when the container is gone.
 */
public interface ContainerEngine {

    /**
     * Creates and starts a container. On failure nothing is left behind.
     */
    ContainerHandle createAndStart(ContainerRequest request);

    void stop(String containerId);

    /**
     * Force-removes the container. Removing a container that is already gone succeeds.
     */
    void remove(String containerId);

    EngineHealth inspectHealth(String containerId);

    void restart(String containerId);

    /**
     * Containers carrying the {@link ContainerLabels#SESSION} label, running or not.
     */
    List<ManagedContainer> listManaged();

    /**
     * Engine version string; throws when the engine is unreachable.
     */
    String version();
}

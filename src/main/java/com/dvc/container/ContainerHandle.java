package com.dvc.container;

import java.util.Map;

/**
 * A created and started container.
 *
 * @param hostPorts container port to the host port actually bound
 * @param accessUrl URL the user reaches the challenge on, null when nothing is published
 */
public record ContainerHandle(
    String containerId,
    String containerName,
    Map<String, Integer> hostPorts,
    String accessUrl
) {

    public ContainerHandle {
        hostPorts = Map.copyOf(hostPorts);
    }
}

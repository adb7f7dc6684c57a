package com.dvc.container;

import com.dvc.core.model.ResourceLimits;
import com.dvc.core.security.SecurityProfile;

import java.util.Map;

/**
 * Everything the engine needs to create and start one challenge container.
 *
 * @param ports        container port ({@code "80/tcp"}) to requested host port, 0 for ephemeral
 * @param environment  fully rendered environment, placeholders already substituted
 * @param limits       resource limits, already clamped to the profile ceiling
 */
public record ContainerRequest(
    String name,
    String image,
    Map<String, Integer> ports,
    Map<String, String> environment,
    Map<String, String> labels,
    SecurityProfile profile,
    ResourceLimits limits
) {

    public ContainerRequest {
        ports = Map.copyOf(ports);
        environment = Map.copyOf(environment);
        labels = Map.copyOf(labels);
    }
}

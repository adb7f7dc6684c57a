package com.dvc.container;

import java.util.Map;

/**
 * A container carrying the engine's labels, as found by {@link ContainerEngine#listManaged()}.
 */
public record ManagedContainer(String containerId, String name, Map<String, String> labels) {

    public ManagedContainer {
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }

    public String sessionId() {
        return labels.get(ContainerLabels.SESSION);
    }
}

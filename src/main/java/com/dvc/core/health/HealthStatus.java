package com.dvc.core.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one engine component (catalog, docker, monitor), as shown by
 * {@code GET /api/v1/health} and {@code dvc health}. Only DOWN makes the
 * engine as a whole unavailable.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, Object> metadata
) {
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static HealthStatus up(String component, String detail, Map<String, Object> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    static HealthStatus degraded(String component, String detail, Map<String, Object> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}

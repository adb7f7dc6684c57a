package com.dvc.container;

/**
 * Container health as reported by the container engine.
 * A container that is not running is {@code UNHEALTHY}; a running container
 * without a health check is {@code HEALTHY}.
 */
public enum EngineHealth {
    HEALTHY,
    UNHEALTHY,
    STARTING,
    NONE,
    UNKNOWN
}

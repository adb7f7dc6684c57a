package com.dvc.core.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts over all tracked containers.
 */
public record HealthSummary(
    boolean running,
    int tracked,
    int healthy,
    int unhealthy,
    int starting,
    int unknown,
    @JsonProperty("total_restart_attempts") int totalRestartAttempts
) {}

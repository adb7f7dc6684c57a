package com.dvc.core.health;

import com.dvc.container.EngineHealth;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Snapshot of what the health monitor knows about one tracked container.
 *
 * @param nextRestartAllowed earliest time another restart may be issued
 */
public record HealthRecord(
    @JsonProperty("container_id") String containerId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("challenge_id") String challengeId,
    @JsonProperty("last_health") EngineHealth lastHealth,
    @JsonProperty("consecutive_failures") int consecutiveFailures,
    @JsonProperty("restart_attempts") int restartAttempts,
    @JsonProperty("last_checked") Instant lastChecked,
    @JsonProperty("next_restart_allowed") Instant nextRestartAllowed
) {}

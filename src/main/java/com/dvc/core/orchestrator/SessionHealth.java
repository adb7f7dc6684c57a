package com.dvc.core.orchestrator;

import com.dvc.core.health.HealthRecord;
import com.dvc.core.model.HealthState;
import com.dvc.core.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Health view of one session.
 *
 * @param monitor the health monitor's record, null when the container is not tracked
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionHealth(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("container_id") String containerId,
    SessionStatus status,
    @JsonProperty("health_status") HealthState healthStatus,
    boolean tracked,
    HealthRecord monitor
) {}

package com.dvc.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Client-facing view of a session. Carries no flag material.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionInfo(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("challenge_id") String challengeId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("container_id") String containerId,
    @JsonProperty("access_url") String accessUrl,
    SessionStatus status,
    @JsonProperty("health_status") HealthState healthStatus,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("expires_at") Instant expiresAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("remaining_seconds") long remainingSeconds,
    String error
) {

    public static SessionInfo from(ChallengeSession session, Instant now) {
        long remaining = session.isActive()
                ? Math.max(0, Duration.between(now, session.expiresAt()).toSeconds())
                : 0;
        return new SessionInfo(
                session.sessionId(),
                session.challengeId(),
                session.userId(),
                session.containerId(),
                session.accessUrl(),
                session.status(),
                session.healthStatus(),
                session.createdAt(),
                session.expiresAt(),
                session.completedAt(),
                remaining,
                session.errorMessage());
    }
}

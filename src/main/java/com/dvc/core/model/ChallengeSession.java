package com.dvc.core.model;

import java.time.Instant;

/**
 * Snapshot of one user's attempt at a challenge.
 *
 * <p>The session registry owns the current value and replaces it on every
 * transition, so a snapshot handed out is never mutated underneath its reader.
 * {@code flagIssuedAt} is the only flag input stored; the flag itself is
 * recomputed on demand and never kept alongside the session.
 *
 * @param containerId   null until the engine confirms creation
 * @param flagIssuedAt  timestamp fed into flag generation for this attempt
 * @param completedAt   set once a correct flag has been accepted
 * @param errorMessage  reason recorded for ERROR sessions
 */
public record ChallengeSession(
    String sessionId,
    String challengeId,
    String userId,
    String containerId,
    String containerName,
    String accessUrl,
    SessionStatus status,
    HealthState healthStatus,
    Instant flagIssuedAt,
    Instant createdAt,
    Instant expiresAt,
    Instant completedAt,
    String errorMessage
) {

    public static ChallengeSession starting(String sessionId, String challengeId, String userId,
                                            Instant createdAt, Instant expiresAt) {
        return new ChallengeSession(sessionId, challengeId, userId, null, null, null,
                SessionStatus.STARTING, HealthState.UNKNOWN, createdAt, createdAt, expiresAt, null, null);
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    public ChallengeSession withStatus(SessionStatus newStatus) {
        return new ChallengeSession(sessionId, challengeId, userId, containerId, containerName, accessUrl,
                newStatus, healthStatus, flagIssuedAt, createdAt, expiresAt, completedAt, errorMessage);
    }

    public ChallengeSession withContainer(String newContainerId, String newContainerName, String newAccessUrl) {
        return new ChallengeSession(sessionId, challengeId, userId, newContainerId, newContainerName, newAccessUrl,
                status, healthStatus, flagIssuedAt, createdAt, expiresAt, completedAt, errorMessage);
    }

    public ChallengeSession withHealth(HealthState newHealth) {
        return new ChallengeSession(sessionId, challengeId, userId, containerId, containerName, accessUrl,
                status, newHealth, flagIssuedAt, createdAt, expiresAt, completedAt, errorMessage);
    }

    public ChallengeSession withCompletedAt(Instant when) {
        return new ChallengeSession(sessionId, challengeId, userId, containerId, containerName, accessUrl,
                status, healthStatus, flagIssuedAt, createdAt, expiresAt, when, errorMessage);
    }

    public ChallengeSession withError(String message) {
        return new ChallengeSession(sessionId, challengeId, userId, containerId, containerName, accessUrl,
                status, healthStatus, flagIssuedAt, createdAt, expiresAt, completedAt, message);
    }
}

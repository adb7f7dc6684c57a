package com.dvc.core.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a flag submission. Never says how close a wrong flag was.
 *
 * @param graceSeconds seconds until teardown, set only for a correct flag
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlagResult(
    @JsonProperty("session_id") String sessionId,
    boolean valid,
    String message,
    Integer points,
    @JsonProperty("grace_seconds") Long graceSeconds,
    String error
) {

    static FlagResult rejected(String sessionId) {
        return new FlagResult(sessionId, false, "Incorrect flag", null, null, null);
    }

    static FlagResult accepted(String sessionId, String message, int points, long graceSeconds) {
        return new FlagResult(sessionId, true, message, points, graceSeconds, null);
    }

    static FlagResult failed(String sessionId, OrchestrationException e) {
        return new FlagResult(sessionId, false, e.getMessage(), null, null, e.kind().name());
    }
}

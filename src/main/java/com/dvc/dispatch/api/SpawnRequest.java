package com.dvc.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param timeoutSeconds optional session lifetime override
 */
public record SpawnRequest(
    @JsonProperty("challenge_id") String challengeId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds
) {}

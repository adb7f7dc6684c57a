package com.dvc.core.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FlagSubmission(@JsonProperty("session_id") String sessionId, String flag) {}

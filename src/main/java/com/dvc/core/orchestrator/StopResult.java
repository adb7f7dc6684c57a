package com.dvc.core.orchestrator;

import com.dvc.core.model.SessionInfo;

public record StopResult(boolean success, String message, SessionInfo session) {}

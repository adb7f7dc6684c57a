package com.dvc.dispatch.api;

import com.dvc.core.orchestrator.FlagSubmission;

import java.util.List;

public record FlagBatchRequest(List<FlagSubmission> submissions) {}

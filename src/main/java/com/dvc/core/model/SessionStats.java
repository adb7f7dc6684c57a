package com.dvc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Counts over the active sessions plus the retained terminal ones.
 */
public record SessionStats(
    int total,
    int active,
    @JsonProperty("by_status") Map<SessionStatus, Integer> byStatus,
    @JsonProperty("unique_users") int uniqueUsers
) {}

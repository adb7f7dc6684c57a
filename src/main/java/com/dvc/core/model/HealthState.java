package com.dvc.core.model;

/**
 * Health of a session's container as last observed by the health monitor.
 */
public enum HealthState {
    UNKNOWN,
    STARTING,
    HEALTHY,
    UNHEALTHY
}

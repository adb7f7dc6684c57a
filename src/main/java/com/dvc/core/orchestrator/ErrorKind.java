package com.dvc.core.orchestrator;

/**
 * Category of an orchestration failure, used to pick the response status.
 */
public enum ErrorKind {
    UNKNOWN_CHALLENGE,
    DUPLICATE_SESSION,
    CONCURRENCY_LIMIT,
    PROVISION_FAILED,
    INVALID_SESSION,
    VALIDATION
}

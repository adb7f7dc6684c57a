package com.dvc.core.orchestrator;

/**
 * The maximum number of concurrent sessions is active.
 */
public class ConcurrencyLimitException extends OrchestrationException {

    public ConcurrencyLimitException(String message) {
        super(ErrorKind.CONCURRENCY_LIMIT, message);
    }
}

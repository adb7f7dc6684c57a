package com.dvc.core.security;

/**
 * Raised when a configured security profile violates the isolation rules.
 * Thrown while the resolver is constructed, so it aborts application start-up.
 */
public class SecurityProfileException extends RuntimeException {

    public SecurityProfileException(String message) {
        super(message);
    }
}

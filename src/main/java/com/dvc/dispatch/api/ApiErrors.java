package com.dvc.dispatch.api;

import com.dvc.core.orchestrator.ErrorKind;
import com.dvc.core.orchestrator.OrchestrationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps orchestration failures to {@code {error, kind, message}} responses.
 */
final class ApiErrors {

    private ApiErrors() {}

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case UNKNOWN_CHALLENGE, INVALID_SESSION -> HttpStatus.NOT_FOUND;
            case DUPLICATE_SESSION -> HttpStatus.CONFLICT;
            case CONCURRENCY_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
            case PROVISION_FAILED -> HttpStatus.BAD_GATEWAY;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
        };
    }

    static ResponseEntity<Object> toResponse(OrchestrationException e) {
        HttpStatus status = statusFor(e.kind());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("kind", e.kind().name());
        body.put("message", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }

    static ResponseEntity<Object> badRequest(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", HttpStatus.BAD_REQUEST.getReasonPhrase());
        body.put("kind", ErrorKind.VALIDATION.name());
        body.put("message", message);
        return ResponseEntity.badRequest().body(body);
    }
}

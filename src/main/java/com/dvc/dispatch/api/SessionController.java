package com.dvc.dispatch.api;

import com.dvc.core.model.SessionInfo;
import com.dvc.core.orchestrator.ChallengeOrchestrator;
import com.dvc.core.orchestrator.OrchestrationException;
import com.dvc.core.orchestrator.StopResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for challenge session lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final ChallengeOrchestrator orchestrator;
    private final SseStreamingService sseStreamingService;
    private final Duration provisionTimeout;

    public SessionController(ChallengeOrchestrator orchestrator,
                             SseStreamingService sseStreamingService,
                             @Value("${dvc.orchestrator.provision-timeout:PT2M}") Duration provisionTimeout) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
        this.provisionTimeout = provisionTimeout;
    }

    /**
     * POST /api/v1/sessions: Spawn a challenge container.
     * Returns 201 with the STARTING session, or the settled session when {@code wait=true}.
     */
    @PostMapping
    public ResponseEntity<Object> spawn(@RequestBody SpawnRequest request,
                                        @RequestParam(name = "wait", defaultValue = "false") boolean wait) {
        try {
            Duration timeout = request.timeoutSeconds() != null
                    ? Duration.ofSeconds(request.timeoutSeconds()) : null;
            SessionInfo session = orchestrator.spawn(request.challengeId(), request.userId(), timeout);
            if (wait) {
                session = orchestrator.awaitProvisioned(session.sessionId(), provisionTimeout);
            }
            return ResponseEntity.status(HttpStatus.CREATED).body(session);
        } catch (OrchestrationException e) {
            log.info("Spawn of {} for {} rejected: {}", request.challengeId(), request.userId(), e.getMessage());
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * DELETE /api/v1/sessions/{id}: Stop a session immediately.
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Object> stop(@PathVariable String sessionId) {
        try {
            StopResult result = orchestrator.stop(sessionId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", result.success());
            body.put("message", result.message());
            body.put("session", result.session());
            return ResponseEntity.ok(body);
        } catch (OrchestrationException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping
    public List<SessionInfo> list() {
        return orchestrator.listRunning();
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<Object> get(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(orchestrator.getSession(sessionId));
        } catch (OrchestrationException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{sessionId}/health")
    public ResponseEntity<Object> health(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(orchestrator.getSessionHealth(sessionId));
        } catch (OrchestrationException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * GET /api/v1/sessions/{id}/events: SSE stream of session lifecycle events.
     */
    @GetMapping(value = "/{sessionId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String sessionId) {
        try {
            orchestrator.getSession(sessionId);
        } catch (OrchestrationException e) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(sessionId));
    }
}

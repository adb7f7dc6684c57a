package com.dvc.dispatch.api;

import com.dvc.core.model.HealthState;
import com.dvc.core.model.SessionInfo;
import com.dvc.core.model.SessionStatus;
import com.dvc.core.orchestrator.ChallengeOrchestrator;
import com.dvc.core.orchestrator.ConcurrencyLimitException;
import com.dvc.core.orchestrator.DuplicateSessionException;
import com.dvc.core.orchestrator.InvalidSessionException;
import com.dvc.core.orchestrator.ProvisionException;
import com.dvc.core.orchestrator.SessionHealth;
import com.dvc.core.orchestrator.StopResult;
import com.dvc.core.orchestrator.UnknownChallengeException;
import com.dvc.core.orchestrator.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ChallengeOrchestrator orchestrator;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static SessionInfo session(String id, SessionStatus status, String containerId, String accessUrl) {
        return new SessionInfo(id, "xss-01", "alice", containerId, accessUrl, status, HealthState.UNKNOWN,
                NOW, NOW.plusSeconds(3600), null, 3600, null);
    }

    private String spawnBody(Integer timeoutSeconds) throws Exception {
        return objectMapper.writeValueAsString(new SpawnRequest("xss-01", "alice", timeoutSeconds));
    }

    // ── POST /api/v1/sessions ────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/sessions")
    class Spawn {

        @Test
        @DisplayName("returns 201 with the STARTING session")
        void spawn() throws Exception {
            when(orchestrator.spawn("xss-01", "alice", null))
                    .thenReturn(session("abc123", SessionStatus.STARTING, null, null));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(spawnBody(null)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.session_id").value("abc123"))
                    .andExpect(jsonPath("$.status").value("STARTING"))
                    .andExpect(jsonPath("$.remaining_seconds").value(3600))
                    .andExpect(jsonPath("$.container_id").doesNotExist());
            verify(orchestrator, never()).awaitProvisioned(any(), any());
        }

        @Test
        @DisplayName("wait=true returns the running session with its access URL")
        void spawnAndWait() throws Exception {
            when(orchestrator.spawn(eq("xss-01"), eq("alice"), isNull()))
                    .thenReturn(session("abc123", SessionStatus.STARTING, null, null));
            when(orchestrator.awaitProvisioned(eq("abc123"), any()))
                    .thenReturn(session("abc123", SessionStatus.RUNNING, "c-1", "http://localhost:32768"));

            mockMvc.perform(post("/api/v1/sessions?wait=true")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(spawnBody(null)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("RUNNING"))
                    .andExpect(jsonPath("$.access_url").value("http://localhost:32768"));
        }

        @Test
        @DisplayName("passes timeout_seconds as the lifetime override")
        void timeoutOverride() throws Exception {
            when(orchestrator.spawn("xss-01", "alice", Duration.ofSeconds(600)))
                    .thenReturn(session("abc123", SessionStatus.STARTING, null, null));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(spawnBody(600)))
                    .andExpect(status().isCreated());
            verify(orchestrator).spawn("xss-01", "alice", Duration.ofSeconds(600));
        }

        @Test
        @DisplayName("duplicate session returns 409")
        void duplicate() throws Exception {
            when(orchestrator.spawn(any(), any(), any()))
                    .thenThrow(new DuplicateSessionException("User alice already has an active session"));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(spawnBody(null)))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.kind").value("DUPLICATE_SESSION"))
                    .andExpect(jsonPath("$.message", containsString("already has")));
        }

        @Test
        @DisplayName("concurrency limit returns 429")
        void limit() throws Exception {
            when(orchestrator.spawn(any(), any(), any()))
                    .thenThrow(new ConcurrencyLimitException("Maximum of 5 concurrent sessions reached"));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(spawnBody(null)))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(jsonPath("$.kind").value("CONCURRENCY_LIMIT"));
        }

        @Test
        @DisplayName("unknown challenge returns 404")
        void unknownChallenge() throws Exception {
            when(orchestrator.spawn(any(), any(), any()))
                    .thenThrow(new UnknownChallengeException("Unknown challenge: nope"));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(spawnBody(null)))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("Not Found"));
        }

        @Test
        @DisplayName("validation failure returns 400")
        void validation() throws Exception {
            when(orchestrator.spawn(any(), any(), any()))
                    .thenThrow(new ValidationException("user_id is required"));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"challenge_id\":\"xss-01\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("VALIDATION"));
        }

        @Test
        @DisplayName("provisioning failure while waiting returns 502")
        void provisionFailed() throws Exception {
            when(orchestrator.spawn(any(), any(), any()))
                    .thenReturn(session("abc123", SessionStatus.STARTING, null, null));
            when(orchestrator.awaitProvisioned(eq("abc123"), any()))
                    .thenThrow(new ProvisionException("Provisioning failed: image not found"));

            mockMvc.perform(post("/api/v1/sessions?wait=true")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(spawnBody(null)))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.kind").value("PROVISION_FAILED"));
        }
    }

    // ── DELETE and GET ───────────────────────────────────────────────

    @Test
    @DisplayName("DELETE /sessions/{id} returns the stop result")
    void stop() throws Exception {
        when(orchestrator.stop("abc123")).thenReturn(
                new StopResult(true, "Session stopped", session("abc123", SessionStatus.STOPPED, "c-1", null)));

        mockMvc.perform(delete("/api/v1/sessions/abc123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Session stopped"))
                .andExpect(jsonPath("$.session.status").value("STOPPED"));
    }

    @Test
    @DisplayName("DELETE for an unknown session returns 404")
    void stopUnknown() throws Exception {
        when(orchestrator.stop("missing")).thenThrow(new InvalidSessionException("Unknown session: missing"));

        mockMvc.perform(delete("/api/v1/sessions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("INVALID_SESSION"));
    }

    @Test
    @DisplayName("GET /sessions lists running sessions")
    void list() throws Exception {
        when(orchestrator.listRunning()).thenReturn(List.of(
                session("a", SessionStatus.RUNNING, "c-1", "http://localhost:1"),
                session("b", SessionStatus.STARTING, null, null)));

        mockMvc.perform(get("/api/v1/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].session_id").value("a"))
                .andExpect(jsonPath("$[1].status").value("STARTING"));
    }

    @Test
    @DisplayName("GET /sessions/{id} returns the session")
    void getSession() throws Exception {
        when(orchestrator.getSession("abc123")).thenReturn(session("abc123", SessionStatus.RUNNING, "c-1", null));

        mockMvc.perform(get("/api/v1/sessions/abc123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.challenge_id").value("xss-01"))
                .andExpect(jsonPath("$.health_status").value("UNKNOWN"))
                .andExpect(jsonPath("$.created_at").value("2026-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("GET /sessions/{id}/health returns the health view")
    void sessionHealth() throws Exception {
        when(orchestrator.getSessionHealth("abc123")).thenReturn(
                new SessionHealth("abc123", "c-1", SessionStatus.RUNNING, HealthState.HEALTHY, false, null));

        mockMvc.perform(get("/api/v1/sessions/abc123/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.health_status").value("HEALTHY"))
                .andExpect(jsonPath("$.tracked").value(false))
                .andExpect(jsonPath("$.monitor").doesNotExist());
    }

    @Test
    @DisplayName("GET /sessions/{id}/events for an unknown session returns 404")
    void eventsUnknown() throws Exception {
        when(orchestrator.getSession("missing")).thenThrow(new InvalidSessionException("Unknown session: missing"));

        mockMvc.perform(get("/api/v1/sessions/missing/events"))
                .andExpect(status().isNotFound());
        verify(sseStreamingService, never()).createEmitter(any());
    }
}

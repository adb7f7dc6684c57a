package com.dvc.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Nested
    @DisplayName("SessionStatus")
    class Status {

        @Test
        @DisplayName("follows the session lifecycle")
        void transitions() {
            assertTrue(SessionStatus.STARTING.canTransitionTo(SessionStatus.RUNNING));
            assertTrue(SessionStatus.STARTING.canTransitionTo(SessionStatus.STOPPING));
            assertTrue(SessionStatus.RUNNING.canTransitionTo(SessionStatus.ERROR));
            assertTrue(SessionStatus.STOPPING.canTransitionTo(SessionStatus.STOPPED));
            assertFalse(SessionStatus.RUNNING.canTransitionTo(SessionStatus.STARTING));
            assertFalse(SessionStatus.RUNNING.canTransitionTo(SessionStatus.STOPPED));
            assertFalse(SessionStatus.STOPPING.canTransitionTo(SessionStatus.RUNNING));
        }

        @Test
        @DisplayName("terminal states allow no further moves")
        void terminal() {
            for (SessionStatus next : SessionStatus.values()) {
                assertFalse(SessionStatus.STOPPED.canTransitionTo(next));
                assertFalse(SessionStatus.ERROR.canTransitionTo(next));
            }
            assertTrue(SessionStatus.STOPPED.isTerminal());
            assertFalse(SessionStatus.STOPPING.isTerminal());
        }
    }

    @Nested
    @DisplayName("ResourceLimits")
    class Limits {

        @Test
        @DisplayName("non-positive values fall back to defaults")
        void defaults() {
            assertEquals(ResourceLimits.DEFAULT, new ResourceLimits(0, -1, 0));
        }

        @Test
        @DisplayName("clampTo caps each value at the ceiling")
        void clamp() {
            var clamped = new ResourceLimits(2048, 0.25, 512).clampTo(new ResourceLimits(512, 1.0, 256));
            assertEquals(new ResourceLimits(512, 0.25, 256), clamped);
        }
    }

    @Nested
    @DisplayName("SessionInfo")
    class Info {

        @Test
        @DisplayName("reports remaining seconds for active sessions only")
        void remaining() {
            var session = ChallengeSession.starting("s1", "xss-01", "alice", NOW, NOW.plusSeconds(600));
            assertEquals(540, SessionInfo.from(session, NOW.plusSeconds(60)).remainingSeconds());
            assertEquals(0, SessionInfo.from(session, NOW.plusSeconds(900)).remainingSeconds());
            assertEquals(0, SessionInfo.from(session.withStatus(SessionStatus.STOPPED), NOW).remainingSeconds());
        }

        @Test
        @DisplayName("serializes in snake_case without flag material")
        void json() throws Exception {
            var mapper = new ObjectMapper().registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            var session = ChallengeSession.starting("s1", "xss-01", "alice", NOW, NOW.plusSeconds(600));

            String json = mapper.writeValueAsString(SessionInfo.from(session, NOW));

            assertTrue(json.contains("\"session_id\":\"s1\""));
            assertTrue(json.contains("\"status\":\"STARTING\""));
            assertTrue(json.contains("\"remaining_seconds\":600"));
            assertFalse(json.contains("flag"));
            assertFalse(json.contains("container_id"));
        }
    }

    @Test
    @DisplayName("Difficulty reads and writes lowercase names")
    void difficulty() {
        assertEquals(Difficulty.EXPERT, Difficulty.fromJson(" Expert "));
        assertEquals("intermediate", Difficulty.INTERMEDIATE.jsonValue());
    }
}

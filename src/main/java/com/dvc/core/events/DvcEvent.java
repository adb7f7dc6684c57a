package com.dvc.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A session lifecycle event, used for SSE streaming and CLI watch mode.
 *
 * @param eventType   e.g. "session.starting", "session.running", "flag.rejected", "session.completed"
 * @param sessionId   the session this event belongs to
 * @param challengeId the challenge of that session
 * @param payload     event-specific data
 * @param timestamp   when the event occurred
 */
public record DvcEvent(
    String eventType,
    String sessionId,
    String challengeId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public DvcEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}

package com.dvc.core.logging;

import com.dvc.core.model.ChallengeSession;
import org.slf4j.MDC;

/**
 * Sets the session MDC keys printed by the log pattern.
 * Use {@link #forSession} in try-with-resources so the keys are cleared on exit.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String CHALLENGE_ID = "challengeId";
    public static final String USER_ID = "userId";
    public static final String CONTAINER_ID = "containerId";

    private MdcContext() {}

    public static Scope forSession(ChallengeSession session) {
        setSession(session.sessionId(), session.challengeId(), session.userId());
        if (session.containerId() != null) {
            MDC.put(CONTAINER_ID, shortId(session.containerId()));
        }
        return MdcContext::clear;
    }

    public static void setSession(String sessionId, String challengeId, String userId) {
        putIfPresent(SESSION_ID, sessionId);
        putIfPresent(CHALLENGE_ID, challengeId);
        putIfPresent(USER_ID, userId);
    }

    public static void setContainer(String containerId) {
        MDC.put(CONTAINER_ID, shortId(containerId));
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(CHALLENGE_ID);
        MDC.remove(USER_ID);
        MDC.remove(CONTAINER_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static String shortId(String containerId) {
        return containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}

package com.dvc.core.session;

import com.dvc.config.DvcProperties;
import com.dvc.core.model.ChallengeSession;
import com.dvc.core.model.HealthState;
import com.dvc.core.model.SessionStats;
import com.dvc.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * In-memory store of challenge sessions.
 *
 * <p>One lock guards the active sessions, the {@code (challengeId, userId)}
 * index and the tombstones. Callers only ever see immutable
 * {@link ChallengeSession} snapshots; every change is a read-modify-write
 * under the lock, so concurrent status and health updates never overwrite
 * each other. Status changes are checked against
 * {@link SessionStatus#canTransitionTo}. A session reaching STOPPED or ERROR
 * leaves the active set and is kept as a tombstone, the oldest tombstones
 * being dropped once {@code tombstoneCapacity} is exceeded.
 *
 * <p>No engine call is ever made while the lock is held.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    public enum Registration { REGISTERED, DUPLICATE, LIMIT_REACHED }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ChallengeSession> active = new LinkedHashMap<>();
    private final Map<String, String> activeByPair = new LinkedHashMap<>();
    private final LinkedHashMap<String, ChallengeSession> tombstones;

    @Autowired
    public SessionRegistry(DvcProperties properties) {
        this(properties.getOrchestrator().getTombstoneCapacity());
    }

    public SessionRegistry(int tombstoneCapacity) {
        this.tombstones = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ChallengeSession> eldest) {
                return size() > tombstoneCapacity;
            }
        };
    }

    /**
     * Adds a new STARTING session unless its user already has an active
     * session for the challenge or {@code maxActive} sessions are active.
     */
    public Registration register(ChallengeSession session, int maxActive) {
        lock.lock();
        try {
            String pair = pairKey(session.challengeId(), session.userId());
            if (activeByPair.containsKey(pair)) {
                return Registration.DUPLICATE;
            }
            if (active.size() >= maxActive) {
                return Registration.LIMIT_REACHED;
            }
            active.put(session.sessionId(), session);
            activeByPair.put(pair, session.sessionId());
            return Registration.REGISTERED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Active session or tombstone with this id.
     */
    public Optional<ChallengeSession> get(String sessionId) {
        lock.lock();
        try {
            ChallengeSession session = active.get(sessionId);
            return Optional.ofNullable(session != null ? session : tombstones.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<ChallengeSession> findActive(String challengeId, String userId) {
        lock.lock();
        try {
            String sessionId = activeByPair.get(pairKey(challengeId, userId));
            return Optional.ofNullable(sessionId != null ? active.get(sessionId) : null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an active session to {@code next}, applying {@code changes} in the
     * same step. Returns the new snapshot, or empty when the session is not
     * active or the state machine forbids the move.
     */
    public Optional<ChallengeSession> transition(String sessionId, SessionStatus next,
                                                 UnaryOperator<ChallengeSession> changes) {
        lock.lock();
        try {
            ChallengeSession current = active.get(sessionId);
            if (current == null) {
                return Optional.empty();
            }
            if (!current.status().canTransitionTo(next)) {
                log.debug("Rejected transition {} -> {} for session {}", current.status(), next, sessionId);
                return Optional.empty();
            }
            ChallengeSession updated = changes.apply(current).withStatus(next);
            store(updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ChallengeSession> transition(String sessionId, SessionStatus next) {
        return transition(sessionId, next, UnaryOperator.identity());
    }

    /**
     * Like {@link #transition(String, SessionStatus, UnaryOperator)}, but only
     * when the session is still in {@code expected}. Empty when another thread
     * moved it first.
     */
    public Optional<ChallengeSession> transition(String sessionId, SessionStatus expected, SessionStatus next,
                                                 UnaryOperator<ChallengeSession> changes) {
        lock.lock();
        try {
            ChallengeSession current = active.get(sessionId);
            if (current == null || current.status() != expected) {
                return Optional.empty();
            }
            return transition(sessionId, next, changes);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ChallengeSession> transition(String sessionId, SessionStatus expected, SessionStatus next) {
        return transition(sessionId, expected, next, UnaryOperator.identity());
    }

    /**
     * Applies a change that keeps the status, such as recording the container
     * or completion time. Empty when the session is not active.
     */
    public Optional<ChallengeSession> update(String sessionId, UnaryOperator<ChallengeSession> changes) {
        lock.lock();
        try {
            ChallengeSession current = active.get(sessionId);
            if (current == null) {
                return Optional.empty();
            }
            ChallengeSession updated = changes.apply(current);
            if (updated.status() != current.status()) {
                throw new IllegalArgumentException("Status changes must go through transition()");
            }
            active.put(sessionId, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ChallengeSession> updateHealth(String sessionId, HealthState health) {
        return update(sessionId, s -> s.withHealth(health));
    }

    public List<ChallengeSession> listActive() {
        lock.lock();
        try {
            return List.copyOf(active.values());
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }

    public SessionStats stats() {
        lock.lock();
        try {
            Map<SessionStatus, Integer> byStatus = new EnumMap<>(SessionStatus.class);
            for (SessionStatus status : SessionStatus.values()) {
                byStatus.put(status, 0);
            }
            Set<String> users = new HashSet<>();
            List<ChallengeSession> all = new ArrayList<>(active.values());
            all.addAll(tombstones.values());
            for (ChallengeSession session : all) {
                byStatus.merge(session.status(), 1, Integer::sum);
                users.add(session.userId());
            }
            return new SessionStats(all.size(), active.size(), byStatus, users.size());
        } finally {
            lock.unlock();
        }
    }

    private void store(ChallengeSession updated) {
        if (updated.status().isTerminal()) {
            active.remove(updated.sessionId());
            activeByPair.remove(pairKey(updated.challengeId(), updated.userId()), updated.sessionId());
            tombstones.put(updated.sessionId(), updated);
        } else {
            active.put(updated.sessionId(), updated);
        }
    }

    private static String pairKey(String challengeId, String userId) {
        return challengeId + '\u0000' + userId;
    }
}

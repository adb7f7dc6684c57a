package com.dvc.core.orchestrator;

import com.dvc.config.DvcProperties;
import com.dvc.container.ContainerEngine;
import com.dvc.container.ContainerEngineException;
import com.dvc.container.ContainerHandle;
import com.dvc.container.ContainerLabels;
import com.dvc.container.ContainerRequest;
import com.dvc.container.ManagedContainer;
import com.dvc.core.catalog.ChallengeCatalog;
import com.dvc.core.events.DvcEvent;
import com.dvc.core.events.EventBus;
import com.dvc.core.flag.FlagService;
import com.dvc.core.health.HealthMonitor;
import com.dvc.core.logging.MdcContext;
import com.dvc.core.metrics.DvcMetrics;
import com.dvc.core.model.ChallengeDefinition;
import com.dvc.core.model.ChallengeSession;
import com.dvc.core.model.ContainerSpec;
import com.dvc.core.model.SessionInfo;
import com.dvc.core.model.SessionStatus;
import com.dvc.core.security.SecurityProfile;
import com.dvc.core.security.SecurityProfileResolver;
import com.dvc.core.session.SessionRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns catalog entries into running challenge containers and drives each
 * session through its lifecycle.
 *
 * <p>Request threads only touch the {@link SessionRegistry}; every engine
 * call (create, stop, remove) runs on the engine executor. Timers for the
 * grace period and session expiry run on a single scheduler thread, which
 * hands the actual teardown back to the engine executor.
 *
 * <p>Teardown of a session happens at most once at a time: concurrent
 * triggers (grace timer, manual stop, expiry, health failure) join the
 * teardown already in flight. A teardown whose remove call fails leaves the
 * session STOPPING and is retried by the cleanup sweep.
 */
@Service
public class ChallengeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChallengeOrchestrator.class);

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);

    private final ChallengeCatalog catalog;
    private final SessionRegistry registry;
    private final ContainerEngine engine;
    private final FlagService flagService;
    private final SecurityProfileResolver profiles;
    private final HealthMonitor healthMonitor;
    private final EventBus eventBus;
    private final DvcMetrics metrics;
    private final Clock clock;
    private final DvcProperties.Orchestrator settings;
    private final Executor engineExecutor;
    private final ScheduledExecutorService scheduler;

    private final Map<String, CompletableFuture<ChallengeSession>> provisioning = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> teardowns = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> graceTimers = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> expiryTimers = new ConcurrentHashMap<>();
    private final Set<String> pendingRemovals = ConcurrentHashMap.newKeySet();

    private volatile ScheduledFuture<?> sweep;
    private volatile boolean started;

    @Autowired
    public ChallengeOrchestrator(ChallengeCatalog catalog, SessionRegistry registry, ContainerEngine engine,
                                 FlagService flagService, SecurityProfileResolver profiles,
                                 HealthMonitor healthMonitor, EventBus eventBus,
                                 @Autowired(required = false) DvcMetrics metrics,
                                 DvcProperties properties, Clock clock) {
        this(catalog, registry, engine, flagService, profiles, healthMonitor, eventBus, metrics,
                properties.getOrchestrator(), clock,
                Executors.newFixedThreadPool(properties.getOrchestrator().getEngineThreads(),
                        new NamedDaemonFactory("dvc-engine-")),
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "dvc-session-timers");
                    t.setDaemon(true);
                    return t;
                }));
    }

    ChallengeOrchestrator(ChallengeCatalog catalog, SessionRegistry registry, ContainerEngine engine,
                          FlagService flagService, SecurityProfileResolver profiles,
                          HealthMonitor healthMonitor, EventBus eventBus, DvcMetrics metrics,
                          DvcProperties.Orchestrator settings, Clock clock,
                          Executor engineExecutor, ScheduledExecutorService scheduler) {
        this.catalog = catalog;
        this.registry = registry;
        this.engine = engine;
        this.flagService = flagService;
        this.profiles = profiles;
        this.healthMonitor = healthMonitor;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.engineExecutor = engineExecutor;
        this.scheduler = scheduler;
        healthMonitor.setFailureHandler(this::onUnrecoverable);
    }

    // -- Lifecycle -----------------------------------------------------------

    /**
     * Removes containers left behind by an earlier process and starts the
     * periodic cleanup sweep. Called once the server is up.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        reconcileOrphans();
        long every = settings.getCleanupInterval().toMillis();
        sweep = scheduler.scheduleWithFixedDelay(this::runSweep, every, every, TimeUnit.MILLISECONDS);
        log.info("Orchestrator started (max sessions={}, grace={}s, cleanup every {}s)",
                settings.getMaxConcurrentSessions(), settings.getGracePeriod().toSeconds(),
                settings.getCleanupInterval().toSeconds());
    }

    /**
     * Tears down every active session, then stops the executors.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (sweep != null) {
            sweep.cancel(false);
        }
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (ChallengeSession session : registry.listActive()) {
            pending.add(teardownAsync(session.sessionId(), TeardownReason.SHUTDOWN));
        }
        if (!pending.isEmpty()) {
            log.info("Shutting down: tearing down {} active session(s)", pending.size());
            try {
                CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                        .get(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Not every session was torn down cleanly on shutdown: {}", e.getMessage());
            }
        }
        scheduler.shutdownNow();
        if (engineExecutor instanceof ExecutorService executorService) {
            executorService.shutdown();
        }
        started = false;
    }

    // -- Spawn ---------------------------------------------------------------

    public SessionInfo spawn(String challengeId, String userId) {
        return spawn(challengeId, userId, null);
    }

    /**
     * Registers a STARTING session and provisions its container in the
     * background.
     *
     * @param timeoutOverride session lifetime for this spawn, null for the default
     */
    public SessionInfo spawn(String challengeId, String userId, Duration timeoutOverride) {
        requireText(challengeId, "challenge_id");
        requireText(userId, "user_id");
        ChallengeDefinition challenge = catalog.find(challengeId).orElseThrow(() -> {
            recordSpawn("unknown_challenge");
            return new UnknownChallengeException("Unknown challenge: " + challengeId);
        });
        Duration lifetime = resolveLifetime(timeoutOverride);

        Instant now = clock.instant();
        ChallengeSession session = ChallengeSession.starting(newSessionId(), challengeId, userId,
                now, now.plus(lifetime));

        switch (registry.register(session, settings.getMaxConcurrentSessions())) {
            case DUPLICATE -> {
                recordSpawn("duplicate");
                String existing = registry.findActive(challengeId, userId)
                        .map(ChallengeSession::sessionId).orElse("unknown");
                throw new DuplicateSessionException("User " + userId + " already has an active session ("
                        + existing + ") for challenge " + challengeId);
            }
            case LIMIT_REACHED -> {
                recordSpawn("limit");
                throw new ConcurrencyLimitException("Maximum of " + settings.getMaxConcurrentSessions()
                        + " concurrent sessions reached");
            }
            case REGISTERED -> recordSpawn("accepted");
        }

        try (var mdc = MdcContext.forSession(session)) {
            log.info("Session {} STARTING for challenge {} (user {}, expires {})",
                    session.sessionId(), challengeId, userId, session.expiresAt());
        }
        publish("session.starting", session, Map.of("expires_at", session.expiresAt().toString()));

        CompletableFuture<ChallengeSession> future = new CompletableFuture<>();
        provisioning.put(session.sessionId(), future);
        try {
            engineExecutor.execute(() -> {
                try {
                    future.complete(provision(session, challenge));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                } finally {
                    provisioning.remove(session.sessionId());
                }
            });
        } catch (RejectedExecutionException e) {
            provisioning.remove(session.sessionId());
            failProvisioning(session, "Engine executor unavailable", e);
            future.completeExceptionally(new ProvisionException("Engine executor unavailable", e));
        }
        return SessionInfo.from(session, now);
    }

    /**
     * Waits until the session's container is running or provisioning failed.
     * Returns the session as it stands when {@code timeout} elapses first.
     *
     * @throws ProvisionException when the container could not be started
     */
    public SessionInfo awaitProvisioned(String sessionId, Duration timeout) {
        CompletableFuture<ChallengeSession> future = provisioning.get(sessionId);
        if (future != null) {
            try {
                ChallengeSession session = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                return SessionInfo.from(session, clock.instant());
            } catch (ExecutionException e) {
                if (e.getCause() instanceof OrchestrationException oe) {
                    throw oe;
                }
                throw new ProvisionException("Provisioning failed: " + e.getCause().getMessage(), e.getCause());
            } catch (TimeoutException e) {
                log.debug("Session {} still provisioning after {}ms", sessionId, timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        ChallengeSession current = lookup(sessionId);
        if (current.status() == SessionStatus.ERROR && current.containerId() == null) {
            throw new ProvisionException(current.errorMessage() != null
                    ? current.errorMessage() : "Provisioning failed");
        }
        return SessionInfo.from(current, clock.instant());
    }

    private ChallengeSession provision(ChallengeSession session, ChallengeDefinition challenge) {
        long startNanos = System.nanoTime();
        try (var mdc = MdcContext.forSession(session)) {
            ContainerSpec spec = challenge.containerSpec();
            SecurityProfile profile = profiles.resolve(spec.securityProfile());
            String flag = flagService.generateFlag(session.challengeId(), session.userId(), session.flagIssuedAt());
            String containerName = ContainerLabels.containerName(session.challengeId(), session.sessionId());

            var request = new ContainerRequest(
                    containerName,
                    spec.image(),
                    spec.ports(),
                    environment(session, spec, flag),
                    labels(session, challenge),
                    profile,
                    spec.resourceLimits().clampTo(profile.ceiling()));

            ContainerHandle handle;
            try {
                handle = engine.createAndStart(request);
            } catch (ContainerEngineException e) {
                recordProvisioning(session.challengeId(), false, startNanos);
                failProvisioning(session, e.getMessage(), e);
                throw new ProvisionException(e.getMessage(), e);
            }
            recordProvisioning(session.challengeId(), true, startNanos);
            MdcContext.setContainer(handle.containerId());

            Optional<ChallengeSession> running = registry.transition(session.sessionId(),
                    SessionStatus.STARTING, SessionStatus.RUNNING,
                    s -> s.withContainer(handle.containerId(), handle.containerName(), handle.accessUrl()));
            if (running.isEmpty()) {
                // stopped while the container was being created
                registry.update(session.sessionId(),
                        s -> s.withContainer(handle.containerId(), handle.containerName(), handle.accessUrl()));
                log.info("Session {} was stopped during provisioning, removing container {}",
                        session.sessionId(), handle.containerId());
                if (removeContainer(handle.containerId())) {
                    registry.transition(session.sessionId(), SessionStatus.STOPPING, SessionStatus.STOPPED)
                            .ifPresent(stopped -> {
                                String reason = TeardownReason.STOPPED_WHILE_STARTING.tag();
                                log.info("Session {} STOPPED ({})", stopped.sessionId(), reason);
                                publish("session.stopped", stopped, Map.of("reason", reason));
                            });
                } else {
                    pendingRemovals.add(handle.containerId());
                }
                return registry.get(session.sessionId()).orElse(session);
            }

            ChallengeSession live = running.get();
            healthMonitor.track(handle.containerId(), live.sessionId(), live.challengeId());
            scheduleExpiry(live);
            log.info("Session {} RUNNING at {} (container {})",
                    live.sessionId(), live.accessUrl(), handle.containerId());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("container_id", handle.containerId());
            if (live.accessUrl() != null) {
                payload.put("access_url", live.accessUrl());
            }
            publish("session.running", live, payload);
            return live;
        }
    }

    private void failProvisioning(ChallengeSession session, String reason, Exception cause) {
        String message = "Provisioning failed: " + reason;
        ChallengeSession current = registry.get(session.sessionId()).orElse(session);
        SessionStatus terminal = current.status() == SessionStatus.STOPPING ? SessionStatus.STOPPED : SessionStatus.ERROR;
        registry.transition(session.sessionId(), terminal, s -> s.withError(message));
        log.error("Session {} {}: {}", session.sessionId(), terminal, message, cause);
        publish("session.failed", session, Map.of("error", message));
    }

    // -- Stop ----------------------------------------------------------------

    /**
     * Stops a session immediately, skipping any remaining grace period.
     * Stopping a session that has already ended succeeds without doing anything.
     */
    public StopResult stop(String sessionId) {
        requireText(sessionId, "session_id");
        ChallengeSession session = lookup(sessionId);
        if (session.status().isTerminal()) {
            return new StopResult(true, "Session already " + session.status().name().toLowerCase(),
                    SessionInfo.from(session, clock.instant()));
        }
        if (session.status() == SessionStatus.STARTING) {
            Optional<ChallengeSession> stopping = registry.transition(sessionId,
                    SessionStatus.STARTING, SessionStatus.STOPPING);
            if (stopping.isPresent()) {
                log.info("Session {} STOPPING before its container is up", sessionId);
                publish("session.stopping", stopping.get(), Map.of("reason", TeardownReason.USER_STOP.tag()));
                recordTeardown(TeardownReason.USER_STOP);
                return new StopResult(true, "Stop requested; the container is removed as soon as it is created",
                        SessionInfo.from(stopping.get(), clock.instant()));
            }
        }

        CompletableFuture<Void> teardown = teardownAsync(sessionId, TeardownReason.USER_STOP);
        try {
            teardown.get(settings.getProvisionTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Teardown of session {} did not finish: {}", sessionId, e.getMessage());
        }
        ChallengeSession after = lookup(sessionId);
        boolean done = after.status().isTerminal();
        return new StopResult(done,
                done ? "Session stopped" : "Stop in progress; container removal will be retried",
                SessionInfo.from(after, clock.instant()));
    }

    // -- Flags ---------------------------------------------------------------

    /**
     * Checks a submitted flag. A correct flag completes the session and starts
     * the grace period; a second correct flag during the grace period is
     * accepted again without extending it.
     */
    public FlagResult validateFlagSubmission(String sessionId, String flag) {
        requireText(sessionId, "session_id");
        requireText(flag, "flag");
        ChallengeSession session = lookup(sessionId);
        if (session.status() != SessionStatus.RUNNING && session.status() != SessionStatus.STOPPING) {
            throw new InvalidSessionException("Session " + sessionId + " is " + session.status()
                    + "; flags are accepted only while it is running");
        }
        ChallengeDefinition challenge = catalog.find(session.challengeId())
                .orElseThrow(() -> new UnknownChallengeException("Unknown challenge: " + session.challengeId()));

        boolean valid = flagService.validateFlag(flag.strip(), session.challengeId(), session.userId(),
                session.flagIssuedAt());
        if (metrics != null) {
            metrics.recordFlagSubmission(valid);
        }
        try (var mdc = MdcContext.forSession(session)) {
            if (!valid) {
                log.info("Incorrect flag submitted for session {}", sessionId);
                publish("flag.rejected", session, Map.of());
                return FlagResult.rejected(sessionId);
            }

            long graceSeconds = settings.getGracePeriod().toSeconds();
            Instant now = clock.instant();
            Optional<ChallengeSession> completed = session.status() == SessionStatus.RUNNING
                    ? registry.transition(sessionId, SessionStatus.RUNNING, SessionStatus.STOPPING,
                            s -> s.withCompletedAt(now))
                    : Optional.empty();
            if (completed.isEmpty()) {
                return alreadyStopping(sessionId, challenge);
            }

            log.info("Session {} completed, {} points; container stops in {}s",
                    sessionId, challenge.points(), graceSeconds);
            publish("session.completed", completed.get(), Map.of(
                    "points", challenge.points(),
                    "grace_seconds", graceSeconds));
            graceTimers.put(sessionId, scheduler.schedule(
                    () -> teardownAsync(sessionId, TeardownReason.COMPLETED),
                    settings.getGracePeriod().toMillis(), TimeUnit.MILLISECONDS));
            return FlagResult.accepted(sessionId,
                    "Correct! Challenge completed. The container stops in " + graceSeconds + " seconds.",
                    challenge.points(), graceSeconds);
        }
    }

    private FlagResult alreadyStopping(String sessionId, ChallengeDefinition challenge) {
        ChallengeSession current = lookup(sessionId);
        if (current.completedAt() != null) {
            long remaining = Math.max(0, settings.getGracePeriod()
                    .minus(Duration.between(current.completedAt(), clock.instant())).toSeconds());
            return FlagResult.accepted(sessionId, "Challenge already completed", challenge.points(), remaining);
        }
        return FlagResult.accepted(sessionId, "Correct flag, but the session is already shutting down",
                challenge.points(), 0);
    }

    /**
     * Validates several submissions; a failing entry is reported in its own
     * result instead of failing the batch.
     */
    public List<FlagResult> validateFlagBatch(List<FlagSubmission> submissions) {
        if (submissions == null || submissions.isEmpty()) {
            throw new ValidationException("At least one submission is required");
        }
        var results = new ArrayList<FlagResult>();
        for (FlagSubmission submission : submissions) {
            try {
                results.add(validateFlagSubmission(submission.sessionId(), submission.flag()));
            } catch (OrchestrationException e) {
                results.add(FlagResult.failed(submission.sessionId(), e));
            }
        }
        return results;
    }

    // -- Queries -------------------------------------------------------------

    public SessionInfo getSession(String sessionId) {
        requireText(sessionId, "session_id");
        return SessionInfo.from(lookup(sessionId), clock.instant());
    }

    /**
     * Active sessions, oldest first.
     */
    public List<SessionInfo> listRunning() {
        Instant now = clock.instant();
        return registry.listActive().stream()
                .sorted(Comparator.comparing(ChallengeSession::createdAt))
                .map(s -> SessionInfo.from(s, now))
                .toList();
    }

    public SessionHealth getSessionHealth(String sessionId) {
        requireText(sessionId, "session_id");
        ChallengeSession session = lookup(sessionId);
        var record = healthMonitor.record(session.containerId());
        return new SessionHealth(session.sessionId(), session.containerId(), session.status(),
                session.healthStatus(), record.isPresent(), record.orElse(null));
    }

    // -- Teardown ------------------------------------------------------------

    /**
     * Starts a teardown, or joins the one already running for this session.
     */
    CompletableFuture<Void> teardownAsync(String sessionId, TeardownReason reason) {
        CompletableFuture<Void> created = new CompletableFuture<>();
        CompletableFuture<Void> existing = teardowns.putIfAbsent(sessionId, created);
        if (existing != null) {
            return existing;
        }
        try {
            engineExecutor.execute(() -> {
                try {
                    teardown(sessionId, reason);
                    created.complete(null);
                } catch (RuntimeException e) {
                    log.error("Teardown of session {} failed", sessionId, e);
                    created.completeExceptionally(e);
                } finally {
                    teardowns.remove(sessionId, created);
                }
            });
        } catch (RejectedExecutionException e) {
            teardowns.remove(sessionId, created);
            created.completeExceptionally(e);
        }
        return created;
    }

    private void teardown(String sessionId, TeardownReason reason) {
        ChallengeSession session = registry.get(sessionId).orElse(null);
        if (session == null || session.status().isTerminal()) {
            return;
        }
        try (var mdc = MdcContext.forSession(session)) {
            if (session.status() == SessionStatus.STARTING) {
                Optional<ChallengeSession> stopping = registry.transition(sessionId,
                        SessionStatus.STARTING, SessionStatus.STOPPING);
                if (stopping.isPresent()) {
                    log.info("Session {} STOPPING ({}) before its container is up", sessionId, reason.tag());
                    publish("session.stopping", stopping.get(), Map.of("reason", reason.tag()));
                    recordTeardown(reason);
                    return;
                }
                // provisioning finished in the meantime
                session = registry.get(sessionId).orElse(null);
                if (session == null || session.status().isTerminal()) {
                    return;
                }
            }
            if (session.status() == SessionStatus.STOPPING && session.containerId() == null
                    && provisioning.containsKey(sessionId)) {
                // the provisioning thread removes the container once it exists
                return;
            }
            if (session.status() == SessionStatus.RUNNING) {
                Optional<ChallengeSession> stopping = registry.transition(sessionId,
                        SessionStatus.RUNNING, SessionStatus.STOPPING);
                if (stopping.isPresent()) {
                    session = stopping.get();
                    log.info("Session {} STOPPING ({})", sessionId, reason.tag());
                    publish("session.stopping", session, Map.of("reason", reason.tag()));
                    recordTeardown(reason);
                } else {
                    session = registry.get(sessionId).orElse(null);
                    if (session == null || session.status() != SessionStatus.STOPPING) {
                        return;
                    }
                    if (session.errorMessage() == null) {
                        recordTeardown(reason);
                    }
                }
            } else if (session.completedAt() != null && reason != TeardownReason.COMPLETED) {
                log.info("Session {} grace period cut short ({})", sessionId, reason.tag());
                recordTeardown(reason);
            } else if (reason == TeardownReason.COMPLETED) {
                recordTeardown(reason);
            }

            cancelTimers(sessionId);
            if (!removeContainer(session.containerId())) {
                log.warn("Session {} left STOPPING; container removal will be retried", sessionId);
                return;
            }
            finish(sessionId, reason);
        }
    }

    /**
     * Ends a STOPPING session whose container is gone: ERROR when a health
     * failure was recorded on it, STOPPED otherwise.
     */
    private void finish(String sessionId, TeardownReason reason) {
        ChallengeSession current = registry.get(sessionId).orElse(null);
        if (current == null || current.status() != SessionStatus.STOPPING) {
            return;
        }
        if (current.errorMessage() != null) {
            registry.transition(sessionId, SessionStatus.STOPPING, SessionStatus.ERROR).ifPresent(failed -> {
                log.error("Session {} ERROR: {}", sessionId, failed.errorMessage());
                publish("session.error", failed, Map.of("error", failed.errorMessage()));
            });
            return;
        }
        registry.transition(sessionId, SessionStatus.STOPPING, SessionStatus.STOPPED).ifPresent(stopped -> {
            log.info("Session {} STOPPED ({})", sessionId, reason.tag());
            publish("session.stopped", stopped, Map.of("reason", reason.tag()));
        });
    }

    /**
     * Untracks, stops and removes a container. Returns false when the remove
     * call failed.
     */
    private boolean removeContainer(String containerId) {
        if (containerId == null) {
            return true;
        }
        healthMonitor.untrack(containerId);
        try {
            engine.stop(containerId);
        } catch (ContainerEngineException e) {
            log.debug("Stop of container {} before removal failed: {}", containerId, e.getMessage());
        }
        try {
            engine.remove(containerId);
            pendingRemovals.remove(containerId);
            return true;
        } catch (ContainerEngineException e) {
            log.warn("Failed to remove container {}: {}", containerId, e.getMessage());
            return false;
        }
    }

    /**
     * Health monitor callback. The session keeps its slot, STOPPING with the
     * failure recorded, until the container is removed; it then ends ERROR.
     */
    void onUnrecoverable(String sessionId, String containerId, String reason) {
        ChallengeSession session = registry.get(sessionId).orElse(null);
        if (session == null || session.status().isTerminal()) {
            engineExecutor.execute(() -> retryableRemove(containerId));
            return;
        }
        try (var mdc = MdcContext.forSession(session)) {
            Optional<ChallengeSession> failing = registry.transition(sessionId,
                    SessionStatus.RUNNING, SessionStatus.STOPPING, s -> s.withError(reason));
            if (failing.isEmpty()) {
                log.warn("Session {} failed its health checks while {}, tearing down now: {}",
                        sessionId, session.status(), reason);
                teardownAsync(sessionId, TeardownReason.HEALTH_FAILURE);
                return;
            }
            log.error("Session {} failed its health checks, removing container {}: {}",
                    sessionId, containerId, reason);
            publish("session.stopping", failing.get(), Map.of("reason", TeardownReason.HEALTH_FAILURE.tag()));
            recordTeardown(TeardownReason.HEALTH_FAILURE);
            teardownAsync(sessionId, TeardownReason.HEALTH_FAILURE);
        }
    }

    private void retryableRemove(String containerId) {
        if (!removeContainer(containerId)) {
            pendingRemovals.add(containerId);
        }
    }

    // -- Timers and sweep ----------------------------------------------------

    private void scheduleExpiry(ChallengeSession session) {
        long delay = Math.max(0, Duration.between(clock.instant(), session.expiresAt()).toMillis());
        expiryTimers.put(session.sessionId(), scheduler.schedule(
                () -> expire(session.sessionId()), delay, TimeUnit.MILLISECONDS));
    }

    private void expire(String sessionId) {
        registry.get(sessionId).filter(ChallengeSession::isActive).ifPresent(s -> {
            try (var mdc = MdcContext.forSession(s)) {
                log.info("Session {} expired at {}", sessionId, s.expiresAt());
            }
            publish("session.expired", s, Map.of());
            teardownAsync(sessionId, TeardownReason.EXPIRED);
        });
    }

    /**
     * Expires overdue sessions, retries failed removals and stuck STOPPING
     * sessions. Never throws.
     */
    void runSweep() {
        try {
            Instant now = clock.instant();
            for (ChallengeSession session : registry.listActive()) {
                String id = session.sessionId();
                if (!now.isBefore(session.expiresAt())) {
                    expire(id);
                } else if (session.status() == SessionStatus.STOPPING
                        && !graceTimers.containsKey(id)
                        && !teardowns.containsKey(id)
                        && !provisioning.containsKey(id)) {
                    teardownAsync(id, TeardownReason.RETRY);
                }
            }
            for (String containerId : List.copyOf(pendingRemovals)) {
                engineExecutor.execute(() -> retryableRemove(containerId));
            }
        } catch (RuntimeException e) {
            log.error("Cleanup sweep failed", e);
        }
    }

    private void cancelTimers(String sessionId) {
        ScheduledFuture<?> grace = graceTimers.remove(sessionId);
        if (grace != null) {
            grace.cancel(false);
        }
        ScheduledFuture<?> expiry = expiryTimers.remove(sessionId);
        if (expiry != null) {
            expiry.cancel(false);
        }
    }

    void reconcileOrphans() {
        List<ManagedContainer> containers;
        try {
            containers = engine.listManaged();
        } catch (ContainerEngineException e) {
            log.warn("Could not look for leftover challenge containers: {}", e.getMessage());
            return;
        }
        int removed = 0;
        for (ManagedContainer container : containers) {
            String sessionId = container.sessionId();
            boolean known = sessionId != null && registry.get(sessionId).map(ChallengeSession::isActive).orElse(false);
            if (known) {
                continue;
            }
            try {
                engine.remove(container.containerId());
                removed++;
                log.info("Removed leftover challenge container {} ({})", container.name(), container.containerId());
            } catch (ContainerEngineException e) {
                log.warn("Failed to remove leftover container {}: {}", container.name(), e.getMessage());
            }
        }
        if (removed > 0 && metrics != null) {
            metrics.recordOrphansRemoved(removed);
        }
    }

    // -- Helpers -------------------------------------------------------------

    private ChallengeSession lookup(String sessionId) {
        return registry.get(sessionId)
                .orElseThrow(() -> new InvalidSessionException("Unknown session: " + sessionId));
    }

    private Duration resolveLifetime(Duration override) {
        if (override == null) {
            return settings.getSessionTimeout();
        }
        if (override.compareTo(settings.getMinSessionTimeout()) < 0
                || override.compareTo(settings.getMaxSessionTimeout()) > 0) {
            throw new ValidationException("Session timeout must be between "
                    + settings.getMinSessionTimeout().toSeconds() + " and "
                    + settings.getMaxSessionTimeout().toSeconds() + " seconds");
        }
        return override;
    }

    private Map<String, String> environment(ChallengeSession session, ContainerSpec spec, String flag) {
        Map<String, String> env = new LinkedHashMap<>();
        spec.environment().forEach((key, value) -> env.put(key, value
                .replace("${SESSION_ID}", session.sessionId())
                .replace("${USER_ID}", session.userId())
                .replace("${CHALLENGE_ID}", session.challengeId())
                .replace("${FLAG}", flag)));
        env.put("CHALLENGE_ID", session.challengeId());
        env.put("USER_ID", session.userId());
        env.put("SESSION_ID", session.sessionId());
        env.put("SESSION_START", String.valueOf(session.createdAt().getEpochSecond()));
        env.put("SESSION_TIMEOUT", String.valueOf(Duration.between(session.createdAt(), session.expiresAt()).toSeconds()));
        env.put("FLAG", flag);
        return env;
    }

    private static Map<String, String> labels(ChallengeSession session, ChallengeDefinition challenge) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(ContainerLabels.ID, session.challengeId());
        labels.put(ContainerLabels.USER, session.userId());
        labels.put(ContainerLabels.SESSION, session.sessionId());
        labels.put(ContainerLabels.STARTED, String.valueOf(session.createdAt().getEpochSecond()));
        labels.put(ContainerLabels.TIMEOUT,
                String.valueOf(Duration.between(session.createdAt(), session.expiresAt()).toSeconds()));
        labels.put(ContainerLabels.NAME, challenge.name());
        labels.put(ContainerLabels.CATEGORY, challenge.category());
        return labels;
    }

    private void publish(String type, ChallengeSession session, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>(extra);
        payload.put("status", session.status().name());
        eventBus.publish(new DvcEvent(type, session.sessionId(), session.challengeId(), payload, clock.instant()));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static String newSessionId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private void recordSpawn(String result) {
        if (metrics != null) {
            metrics.recordSpawn(result);
        }
    }

    private void recordProvisioning(String challengeId, boolean success, long startNanos) {
        if (metrics != null) {
            metrics.recordProvisioning(challengeId, success,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }
    }

    private void recordTeardown(TeardownReason reason) {
        if (metrics != null) {
            metrics.recordTeardown(reason.tag());
        }
    }

    private static final class NamedDaemonFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedDaemonFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

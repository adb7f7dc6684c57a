package com.dvc.core.health;

import com.dvc.config.DvcProperties;
import com.dvc.container.ContainerEngine;
import com.dvc.container.ContainerEngineException;
import com.dvc.container.ContainerNotFoundException;
import com.dvc.container.EngineHealth;
import com.dvc.core.logging.MdcContext;
import com.dvc.core.metrics.DvcMetrics;
import com.dvc.core.model.HealthState;
import com.dvc.core.session.SessionRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Polls the health of every tracked challenge container.
 *
 * <p>One scheduler thread runs the check cycle with a fixed delay; the
 * inspect calls themselves run on a small worker pool and are abandoned
 * after {@code dvc.health.check-timeout}, so one hung container cannot stall
 * the others. For each container:
 * <ul>
 *   <li>HEALTHY (or no health check) resets the failure counter</li>
 *   <li>UNHEALTHY increments it and issues a restart when the backoff allows</li>
 *   <li>more than {@code failure-threshold} consecutive failures, or a further
 *       failure after {@code failure-threshold} restarts, is unrecoverable: tracking
 *       stops and the {@link FailureHandler} is told to tear the session down</li>
 *   <li>a container the engine no longer knows is untracked silently</li>
 *   <li>any other query failure records UNKNOWN and is retried next cycle</li>
 * </ul>
 */
@Service
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    /**
     * Receives containers the monitor has given up on.
     */
    @FunctionalInterface
    public interface FailureHandler {
        void onUnrecoverable(String sessionId, String containerId, String reason);
    }

    private final ContainerEngine engine;
    private final SessionRegistry registry;
    private final DvcMetrics metrics;
    private final Clock clock;
    private final Duration interval;
    private final Duration checkTimeout;
    private final int failureThreshold;
    private final Duration backoffBase;
    private final Duration backoffMax;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final Map<String, Tracked> tracked = new ConcurrentHashMap<>();

    private volatile FailureHandler failureHandler = (sessionId, containerId, reason) ->
            log.warn("No failure handler registered; container {} of session {} left as is", containerId, sessionId);
    private volatile ScheduledFuture<?> loop;

    @Autowired
    public HealthMonitor(ContainerEngine engine, SessionRegistry registry, DvcProperties properties,
                         @Autowired(required = false) DvcMetrics metrics, Clock clock) {
        this(engine, registry, properties.getHealth(), metrics, clock,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "dvc-health-monitor");
                    t.setDaemon(true);
                    return t;
                }),
                Executors.newFixedThreadPool(properties.getHealth().getWorkerThreads(), new NamedDaemonFactory()));
    }

    HealthMonitor(ContainerEngine engine, SessionRegistry registry, DvcProperties.Health settings,
                  DvcMetrics metrics, Clock clock, ScheduledExecutorService scheduler, ExecutorService workers) {
        this.engine = engine;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.interval = settings.getInterval();
        this.checkTimeout = settings.getCheckTimeout();
        this.failureThreshold = settings.getFailureThreshold();
        this.backoffBase = settings.getBackoffBase();
        this.backoffMax = settings.getBackoffMax();
        this.scheduler = scheduler;
        this.workers = workers;
    }

    public void setFailureHandler(FailureHandler failureHandler) {
        this.failureHandler = failureHandler;
    }

    public synchronized void start() {
        if (loop != null) {
            return;
        }
        loop = scheduler.scheduleWithFixedDelay(this::runCycle,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Health monitor started (interval={}s, threshold={})", interval.toSeconds(), failureThreshold);
    }

    @PreDestroy
    public synchronized void stop() {
        if (loop != null) {
            loop.cancel(false);
            loop = null;
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
        tracked.clear();
        log.info("Health monitor stopped");
    }

    public boolean isRunning() {
        return loop != null && !loop.isCancelled();
    }

    public void track(String containerId, String sessionId, String challengeId) {
        tracked.put(containerId, new Tracked(containerId, sessionId, challengeId));
        log.debug("Tracking container {} for session {}", containerId, sessionId);
    }

    public void untrack(String containerId) {
        if (containerId != null && tracked.remove(containerId) != null) {
            log.debug("Stopped tracking container {}", containerId);
        }
    }

    public boolean isTracking(String containerId) {
        return containerId != null && tracked.containsKey(containerId);
    }

    public Optional<HealthRecord> record(String containerId) {
        Tracked t = containerId != null ? tracked.get(containerId) : null;
        return Optional.ofNullable(t != null ? t.snapshot() : null);
    }

    public HealthSummary summary() {
        int healthy = 0, unhealthy = 0, starting = 0, unknown = 0, restarts = 0;
        for (Tracked t : tracked.values()) {
            HealthRecord r = t.snapshot();
            restarts += r.restartAttempts();
            switch (r.lastHealth()) {
                case HEALTHY, NONE -> healthy++;
                case UNHEALTHY -> unhealthy++;
                case STARTING -> starting++;
                case UNKNOWN -> unknown++;
            }
        }
        return new HealthSummary(isRunning(), tracked.size(), healthy, unhealthy, starting, unknown, restarts);
    }

    /**
     * Runs one check over every tracked container and waits for the results.
     */
    public void runCycle() {
        try {
            Map<String, Future<?>> pending = new LinkedHashMap<>();
            for (String containerId : List.copyOf(tracked.keySet())) {
                pending.put(containerId, workers.submit(() -> check(containerId)));
            }
            for (var entry : pending.entrySet()) {
                await(entry.getKey(), entry.getValue());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Health check cycle failed", e);
        }
    }

    private void await(String containerId, Future<?> future) throws InterruptedException {
        try {
            future.get(checkTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Health check of container {} timed out after {}ms", containerId, checkTimeout.toMillis());
            Tracked t = tracked.get(containerId);
            if (t != null) {
                t.observe(EngineHealth.UNKNOWN, clock.instant());
                registry.updateHealth(t.sessionId, HealthState.UNKNOWN);
            }
        } catch (ExecutionException e) {
            log.error("Health check of container {} failed", containerId, e.getCause());
        }
    }

    void check(String containerId) {
        Tracked t = tracked.get(containerId);
        if (t == null) {
            return;
        }
        MdcContext.setSession(t.sessionId, t.challengeId, null);
        MdcContext.setContainer(containerId);
        try {
            EngineHealth health;
            try {
                health = engine.inspectHealth(containerId);
            } catch (ContainerNotFoundException e) {
                tracked.remove(containerId);
                log.info("Container {} no longer exists, untracked", containerId);
                return;
            } catch (ContainerEngineException e) {
                log.warn("Could not query health of container {}: {}", containerId, e.getMessage());
                t.observe(EngineHealth.UNKNOWN, clock.instant());
                registry.updateHealth(t.sessionId, HealthState.UNKNOWN);
                return;
            }
            apply(t, health);
        } finally {
            MdcContext.clear();
        }
    }

    private void apply(Tracked t, EngineHealth health) {
        Instant now = clock.instant();
        t.observe(health, now);
        switch (health) {
            case HEALTHY, NONE -> {
                t.resetFailures();
                registry.updateHealth(t.sessionId, HealthState.HEALTHY);
            }
            case STARTING -> registry.updateHealth(t.sessionId, HealthState.STARTING);
            case UNKNOWN -> registry.updateHealth(t.sessionId, HealthState.UNKNOWN);
            case UNHEALTHY -> onUnhealthy(t, now);
        }
    }

    private void onUnhealthy(Tracked t, Instant now) {
        int failures = t.recordFailure();
        registry.updateHealth(t.sessionId, HealthState.UNHEALTHY);

        if (failures > failureThreshold || t.restartAttempts() >= failureThreshold) {
            String reason = "Container unhealthy after " + failures + " consecutive failure(s) and "
                    + t.restartAttempts() + " restart attempt(s)";
            tracked.remove(t.containerId);
            log.error("Session {} unrecoverable: {}", t.sessionId, reason);
            if (metrics != null) {
                metrics.recordUnrecoverable();
            }
            try {
                failureHandler.onUnrecoverable(t.sessionId, t.containerId, reason);
            } catch (RuntimeException e) {
                log.error("Failure handler threw for session {}", t.sessionId, e);
            }
            return;
        }

        if (now.isBefore(t.nextRestartAllowed())) {
            log.info("Container {} unhealthy ({}/{}), restart deferred until {}",
                    t.containerId, failures, failureThreshold, t.nextRestartAllowed());
            return;
        }

        int attempt = t.recordRestart(now, this::backoff);
        log.warn("Container {} unhealthy ({}/{}), restart attempt {}", t.containerId, failures, failureThreshold, attempt);
        try {
            engine.restart(t.containerId);
            if (metrics != null) {
                metrics.recordHealthRestart(true);
            }
        } catch (ContainerNotFoundException e) {
            tracked.remove(t.containerId);
            log.info("Container {} vanished before restart, untracked", t.containerId);
        } catch (ContainerEngineException e) {
            log.warn("Restart of container {} failed: {}", t.containerId, e.getMessage());
            if (metrics != null) {
                metrics.recordHealthRestart(false);
            }
        }
    }

    /**
     * Delay before the restart following attempt number {@code attempts}:
     * {@code base * 2^(attempts-1)}, capped at the maximum.
     */
    Duration backoff(int attempts) {
        int exponent = Math.max(0, Math.min(attempts - 1, 30));
        Duration delay = backoffBase.multipliedBy(1L << exponent);
        return delay.compareTo(backoffMax) > 0 ? backoffMax : delay;
    }

    private static final class Tracked {
        private final String containerId;
        private final String sessionId;
        private final String challengeId;
        private EngineHealth lastHealth = EngineHealth.UNKNOWN;
        private int consecutiveFailures;
        private int restartAttempts;
        private Instant lastChecked;
        private Instant nextRestartAllowed = Instant.EPOCH;

        Tracked(String containerId, String sessionId, String challengeId) {
            this.containerId = containerId;
            this.sessionId = sessionId;
            this.challengeId = challengeId;
        }

        synchronized void observe(EngineHealth health, Instant when) {
            lastHealth = health;
            lastChecked = when;
        }

        synchronized void resetFailures() {
            consecutiveFailures = 0;
        }

        synchronized int recordFailure() {
            return ++consecutiveFailures;
        }

        synchronized int restartAttempts() {
            return restartAttempts;
        }

        synchronized Instant nextRestartAllowed() {
            return nextRestartAllowed;
        }

        synchronized int recordRestart(Instant now, IntFunction<Duration> backoff) {
            restartAttempts++;
            nextRestartAllowed = now.plus(backoff.apply(restartAttempts));
            return restartAttempts;
        }

        synchronized HealthRecord snapshot() {
            return new HealthRecord(containerId, sessionId, challengeId, lastHealth,
                    consecutiveFailures, restartAttempts, lastChecked, nextRestartAllowed);
        }
    }

    private static final class NamedDaemonFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "dvc-health-check-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

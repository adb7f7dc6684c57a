package com.dvc.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for challenge sessions.
 */
@Service
public class DvcMetrics {

    private final MeterRegistry registry;

    public DvcMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param result "accepted", "duplicate", "limit" or "unknown_challenge"
     */
    public void recordSpawn(String result) {
        Counter.builder("dvc.sessions.spawned")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordProvisioning(String challengeId, boolean success, long ms) {
        Timer.builder("dvc.provisioning.duration")
                .tag("challenge", challengeId)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFlagSubmission(boolean valid) {
        Counter.builder("dvc.flags.submitted")
                .tag("result", valid ? "valid" : "invalid")
                .register(registry)
                .increment();
    }

    public void recordTeardown(String reason) {
        Counter.builder("dvc.sessions.teardowns")
                .description("Container teardowns by trigger")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordHealthRestart(boolean success) {
        Counter.builder("dvc.health.restarts")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordUnrecoverable() {
        Counter.builder("dvc.health.unrecoverable")
                .description("Sessions moved to ERROR by the health monitor")
                .register(registry)
                .increment();
    }

    public void recordOrphansRemoved(int count) {
        Counter.builder("dvc.containers.orphans_removed")
                .register(registry)
                .increment(count);
    }
}

package com.dvc.core.orchestrator;

import com.dvc.core.health.HealthMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the background machinery once the HTTP server is up. CLI runs
 * without a web server and never start it.
 */
@Component
public class EngineLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EngineLifecycle.class);

    private final ChallengeOrchestrator orchestrator;
    private final HealthMonitor healthMonitor;

    public EngineLifecycle(ChallengeOrchestrator orchestrator, HealthMonitor healthMonitor) {
        this.orchestrator = orchestrator;
        this.healthMonitor = healthMonitor;
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        log.info("Web server ready on port {}, starting session engine", event.getWebServer().getPort());
        orchestrator.start();
        healthMonitor.start();
    }
}

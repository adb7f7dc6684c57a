package com.dvc.core.health;

import com.dvc.container.ContainerEngine;
import com.dvc.core.catalog.ChallengeCatalog;
import com.dvc.core.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * System health: catalog, Docker daemon and the container health monitor.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ChallengeCatalog catalog;
    private final ContainerEngine engine;
    private final HealthMonitor healthMonitor;
    private final SessionRegistry registry;

    public HealthCheckService(
            @Autowired(required = false) ChallengeCatalog catalog,
            @Autowired(required = false) ContainerEngine engine,
            @Autowired(required = false) HealthMonitor healthMonitor,
            @Autowired(required = false) SessionRegistry registry) {
        this.catalog = catalog;
        this.engine = engine;
        this.healthMonitor = healthMonitor;
        this.registry = registry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCatalog());
        results.add(checkDocker());
        results.add(checkMonitor());
        return results;
    }

    HealthStatus checkCatalog() {
        if (catalog == null) {
            return HealthStatus.down("catalog", "No challenge catalog loaded");
        }
        if (catalog.size() == 0) {
            return HealthStatus.degraded("catalog", "Catalog " + catalog.source() + " is empty",
                    Map.of("challenges", 0));
        }
        return HealthStatus.up("catalog", catalog.size() + " challenge(s) from " + catalog.source(),
                Map.of("challenges", catalog.size()));
    }

    HealthStatus checkDocker() {
        if (engine == null) {
            return HealthStatus.down("docker", "No container engine configured");
        }
        try {
            String version = engine.version();
            return HealthStatus.up("docker", "Docker " + version + " reachable", Map.of("version", version));
        } catch (RuntimeException e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return HealthStatus.down("docker", "Docker error: " + e.getMessage());
        }
    }

    HealthStatus checkMonitor() {
        if (healthMonitor == null) {
            return HealthStatus.down("monitor", "Health monitor not available");
        }
        HealthSummary summary = healthMonitor.summary();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("health", summary);
        if (registry != null) {
            metadata.put("sessions", registry.stats());
        }
        if (!summary.running()) {
            return HealthStatus.degraded("monitor", "Health monitor idle (starts with the server)", metadata);
        }
        if (summary.unhealthy() > 0) {
            return HealthStatus.degraded("monitor",
                    summary.unhealthy() + " of " + summary.tracked() + " container(s) unhealthy", metadata);
        }
        return HealthStatus.up("monitor", "Tracking " + summary.tracked() + " container(s)", metadata);
    }
}

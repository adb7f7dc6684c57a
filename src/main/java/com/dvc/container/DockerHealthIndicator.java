package com.dvc.container;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of Docker daemon reachability.
 */
@Component
public class DockerHealthIndicator implements HealthIndicator {

    private final ContainerEngine engine;

    public DockerHealthIndicator(ContainerEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        try {
            return Health.up().withDetail("version", engine.version()).build();
        } catch (ContainerEngineException e) {
            return Health.down().withDetail("error", e.getMessage()).build();
        }
    }
}

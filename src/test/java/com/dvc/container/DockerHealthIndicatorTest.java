package com.dvc.container;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DockerHealthIndicatorTest {

    @Test
    void upWithDaemonVersion() {
        ContainerEngine engine = mock(ContainerEngine.class);
        when(engine.version()).thenReturn("27.3.1");

        Health health = new DockerHealthIndicator(engine).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("27.3.1", health.getDetails().get("version"));
    }

    @Test
    void downWhenDaemonUnreachable() {
        ContainerEngine engine = mock(ContainerEngine.class);
        when(engine.version()).thenThrow(new ContainerEngineException("Docker daemon unreachable"));

        Health health = new DockerHealthIndicator(engine).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Docker daemon unreachable", health.getDetails().get("error"));
    }
}

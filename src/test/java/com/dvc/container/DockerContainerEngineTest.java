package com.dvc.container;

import com.dvc.core.model.ResourceLimits;
import com.dvc.core.security.SecurityProfile;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.*;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.NetworkSettings;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.Version;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link DockerContainerEngine}, chaining docker-java's fluent
 * commands by hand so every call can be verified.
 */
class DockerContainerEngineTest {

    private static final SecurityProfile DEFAULT_PROFILE = new SecurityProfile(
            "default", List.of("ALL"), List.of(), true,
            Map.of("/tmp", "rw,noexec,nosuid,size=100m"), "1000:1000", true,
            new ResourceLimits(512, 1.0, 256));

    private DockerClient dockerClient;
    private DockerContainerEngine engine;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        engine = new DockerContainerEngine(dockerClient, "challenges.local", "bridge",
                Duration.ofSeconds(10), Duration.ofSeconds(30));
        mockInspectImageSuccess();
    }

    private static ContainerRequest request(Map<String, Integer> ports, SecurityProfile profile) {
        return new ContainerRequest("dvc-xss-01-abc", "dvc/xss-01:latest", ports,
                Map.of("FLAG", "flag{0123456789abcdef}", "USER_ID", "alice"),
                Map.of(ContainerLabels.SESSION, "abc", ContainerLabels.ID, "xss-01"),
                profile, new ResourceLimits(256, 0.5, 128));
    }

    // -- createAndStart ---------------------------------------------------

    @Nested
    @DisplayName("createAndStart")
    class CreateAndStart {

        @Test
        @DisplayName("creates, starts and reports the bound port")
        void createsAndStarts() {
            var createCmd = mockCreateContainerCmd("c-123");
            var startCmd = mock(StartContainerCmd.class);
            when(dockerClient.startContainerCmd("c-123")).thenReturn(startCmd);
            mockInspectContainer("c-123", Map.of("80/tcp", "32768"));

            ContainerHandle handle = engine.createAndStart(request(Map.of("80/tcp", 0), DEFAULT_PROFILE));

            assertEquals("c-123", handle.containerId());
            assertEquals("dvc-xss-01-abc", handle.containerName());
            assertEquals(32768, handle.hostPorts().get("80/tcp"));
            assertEquals("http://challenges.local:32768", handle.accessUrl());
            verify(dockerClient).createContainerCmd("dvc/xss-01:latest");
            verify(createCmd).withName("dvc-xss-01-abc");
            verify(createCmd).withUser("1000:1000");
            verify(createCmd).withLabels(Map.of(ContainerLabels.SESSION, "abc", ContainerLabels.ID, "xss-01"));
            verify(startCmd).exec();
        }

        @Test
        @DisplayName("passes the rendered environment as KEY=VALUE entries")
        @SuppressWarnings("unchecked")
        void environment() {
            var createCmd = mockCreateContainerCmd("c-env");
            when(dockerClient.startContainerCmd(anyString())).thenReturn(mock(StartContainerCmd.class));
            mockInspectContainer("c-env", Map.of());

            engine.createAndStart(request(Map.of(), DEFAULT_PROFILE));

            ArgumentCaptor<List<String>> envCaptor = ArgumentCaptor.forClass(List.class);
            verify(createCmd).withEnv(envCaptor.capture());
            assertTrue(envCaptor.getValue().contains("FLAG=flag{0123456789abcdef}"));
            assertTrue(envCaptor.getValue().contains("USER_ID=alice"));
        }

        @Test
        @DisplayName("applies the security profile and limits to the host config")
        void hostConfig() {
            var createCmd = mockCreateContainerCmd("c-sec");
            when(dockerClient.startContainerCmd(anyString())).thenReturn(mock(StartContainerCmd.class));
            mockInspectContainer("c-sec", Map.of());

            engine.createAndStart(request(Map.of("80/tcp", 0), DEFAULT_PROFILE));

            var captor = ArgumentCaptor.forClass(HostConfig.class);
            verify(createCmd).withHostConfig(captor.capture());
            HostConfig config = captor.getValue();
            assertEquals(256L * 1024 * 1024, config.getMemory());
            assertEquals(256L * 1024 * 1024, config.getMemorySwap());
            assertEquals(500_000_000L, config.getNanoCPUs());
            assertEquals(128L, config.getPidsLimit());
            assertArrayEquals(new Capability[]{Capability.ALL}, config.getCapDrop());
            assertEquals(0, config.getCapAdd().length);
            assertTrue(config.getReadonlyRootfs());
            assertEquals("rw,noexec,nosuid,size=100m", config.getTmpFs().get("/tmp"));
            assertEquals(List.of("no-new-privileges:true"), config.getSecurityOpts());
            assertEquals("bridge", config.getNetworkMode());
            assertFalse(config.getPrivileged());
        }

        @Test
        @DisplayName("adds the profile's extra capabilities")
        void addedCapabilities() {
            var lab = new SecurityProfile("network-lab", List.of("ALL"), List.of("NET_ADMIN", "NET_RAW"),
                    true, Map.of(), "1000:1000", true, new ResourceLimits(512, 1.0, 256));

            HostConfig config = engine.hostConfig(request(Map.of(), lab));

            assertArrayEquals(new Capability[]{Capability.NET_ADMIN, Capability.NET_RAW}, config.getCapAdd());
        }

        @Test
        @DisplayName("removes the container when start fails")
        void cleansUpOnStartFailure() {
            mockCreateContainerCmd("c-fail");
            var startCmd = mock(StartContainerCmd.class);
            when(dockerClient.startContainerCmd("c-fail")).thenReturn(startCmd);
            when(startCmd.exec()).thenThrow(new DockerException("port already allocated", 500));
            var removeCmd = mockRemoveContainerCmd("c-fail");

            var ex = assertThrows(ContainerEngineException.class,
                    () -> engine.createAndStart(request(Map.of("80/tcp", 8080), DEFAULT_PROFILE)));

            assertTrue(ex.getMessage().contains("dvc-xss-01-abc"));
            verify(removeCmd).withForce(true);
            verify(removeCmd).exec();
        }

        @Test
        @DisplayName("pulls the image when it is missing locally")
        void pullsMissingImage() throws Exception {
            var inspectCmd = mock(InspectImageCmd.class);
            when(dockerClient.inspectImageCmd("dvc/xss-01:latest")).thenReturn(inspectCmd);
            when(inspectCmd.exec()).thenThrow(new NotFoundException("no such image"));

            var pullCmd = mock(PullImageCmd.class, RETURNS_SELF);
            when(dockerClient.pullImageCmd("dvc/xss-01:latest")).thenReturn(pullCmd);
            doAnswer(invocation -> {
                var callback = (PullImageResultCallback) invocation.getArgument(0);
                callback.onComplete();
                return callback;
            }).when(pullCmd).exec(any());

            mockCreateContainerCmd("c-pulled");
            when(dockerClient.startContainerCmd(anyString())).thenReturn(mock(StartContainerCmd.class));
            mockInspectContainer("c-pulled", Map.of());

            engine.createAndStart(request(Map.of(), DEFAULT_PROFILE));

            verify(dockerClient).pullImageCmd("dvc/xss-01:latest");
        }
    }

    // -- accessUrl ---------------------------------------------------------

    @Nested
    @DisplayName("accessUrl")
    class AccessUrl {

        @Test
        @DisplayName("prefers port 80 over other published ports")
        void prefersHttp() {
            var ports = new LinkedHashMap<String, Integer>();
            ports.put("22/tcp", 40001);
            ports.put("8080/tcp", 40002);
            ports.put("80/tcp", 40003);
            assertEquals("http://challenges.local:40003", engine.accessUrl(ports));
        }

        @Test
        @DisplayName("falls back to the first published port")
        void firstPort() {
            var ports = new LinkedHashMap<String, Integer>();
            ports.put("22/tcp", 40001);
            ports.put("9999/tcp", 40002);
            assertEquals("http://challenges.local:40001", engine.accessUrl(ports));
        }

        @Test
        @DisplayName("is null when nothing is published")
        void none() {
            assertNull(engine.accessUrl(Map.of()));
        }
    }

    // -- stop / remove ---------------------------------------------------

    @Nested
    @DisplayName("stop and remove")
    class StopAndRemove {

        @Test
        @DisplayName("stop uses the configured timeout")
        void stopTimeout() {
            var stopCmd = mock(StopContainerCmd.class, RETURNS_SELF);
            when(dockerClient.stopContainerCmd("c-1")).thenReturn(stopCmd);

            engine.stop("c-1");

            verify(stopCmd).withTimeout(10);
            verify(stopCmd).exec();
        }

        @Test
        @DisplayName("stopping an already stopped container is not an error")
        void alreadyStopped() {
            var stopCmd = mock(StopContainerCmd.class, RETURNS_SELF);
            when(dockerClient.stopContainerCmd("c-1")).thenReturn(stopCmd);
            when(stopCmd.exec()).thenThrow(new NotModifiedException("already stopped"));

            assertDoesNotThrow(() -> engine.stop("c-1"));
        }

        @Test
        @DisplayName("stopping a missing container raises ContainerNotFoundException")
        void stopMissing() {
            var stopCmd = mock(StopContainerCmd.class, RETURNS_SELF);
            when(dockerClient.stopContainerCmd("c-1")).thenReturn(stopCmd);
            when(stopCmd.exec()).thenThrow(new NotFoundException("gone"));

            assertThrows(ContainerNotFoundException.class, () -> engine.stop("c-1"));
        }

        @Test
        @DisplayName("remove forces and drops volumes")
        void remove() {
            var removeCmd = mockRemoveContainerCmd("c-1");

            engine.remove("c-1");

            verify(removeCmd).withForce(true);
            verify(removeCmd).withRemoveVolumes(true);
            verify(removeCmd).exec();
        }

        @Test
        @DisplayName("removing a missing container succeeds")
        void removeMissing() {
            var removeCmd = mockRemoveContainerCmd("c-1");
            when(removeCmd.exec()).thenThrow(new NotFoundException("gone"));

            assertDoesNotThrow(() -> engine.remove("c-1"));
        }

        @Test
        @DisplayName("other remove failures are raised")
        void removeFailure() {
            var removeCmd = mockRemoveContainerCmd("c-1");
            when(removeCmd.exec()).thenThrow(new DockerException("device busy", 500));

            assertThrows(ContainerEngineException.class, () -> engine.remove("c-1"));
        }
    }

    // -- inspectHealth ---------------------------------------------------

    @Nested
    @DisplayName("inspectHealth")
    class InspectHealth {

        private void mockState(Boolean running, String healthStatus) {
            var inspectCmd = mock(InspectContainerCmd.class);
            when(dockerClient.inspectContainerCmd("c-1")).thenReturn(inspectCmd);
            var response = mock(InspectContainerResponse.class);
            when(inspectCmd.exec()).thenReturn(response);
            var state = mock(InspectContainerResponse.ContainerState.class);
            when(response.getState()).thenReturn(state);
            when(state.getRunning()).thenReturn(running);
            if (healthStatus != null) {
                var health = mock(HealthState.class);
                when(health.getStatus()).thenReturn(healthStatus);
                when(state.getHealth()).thenReturn(health);
            }
        }

        @Test
        @DisplayName("a running container without a health check is healthy")
        void noHealthCheck() {
            mockState(true, null);
            assertEquals(EngineHealth.HEALTHY, engine.inspectHealth("c-1"));
        }

        @Test
        @DisplayName("maps the Docker health status")
        void mapsStatus() {
            mockState(true, "unhealthy");
            assertEquals(EngineHealth.UNHEALTHY, engine.inspectHealth("c-1"));
        }

        @Test
        @DisplayName("a starting health check is reported as starting")
        void starting() {
            mockState(true, "starting");
            assertEquals(EngineHealth.STARTING, engine.inspectHealth("c-1"));
        }

        @Test
        @DisplayName("a stopped container is unhealthy")
        void notRunning() {
            mockState(false, "healthy");
            assertEquals(EngineHealth.UNHEALTHY, engine.inspectHealth("c-1"));
        }

        @Test
        @DisplayName("a missing container raises ContainerNotFoundException")
        void missing() {
            var inspectCmd = mock(InspectContainerCmd.class);
            when(dockerClient.inspectContainerCmd("c-1")).thenReturn(inspectCmd);
            when(inspectCmd.exec()).thenThrow(new NotFoundException("gone"));

            assertThrows(ContainerNotFoundException.class, () -> engine.inspectHealth("c-1"));
        }
    }

    @Test
    @DisplayName("listManaged returns labelled containers with their session id")
    void listManaged() {
        var listCmd = mock(ListContainersCmd.class, RETURNS_SELF);
        when(dockerClient.listContainersCmd()).thenReturn(listCmd);
        var container = mock(Container.class);
        when(container.getId()).thenReturn("c-9");
        when(container.getNames()).thenReturn(new String[]{"/dvc-xss-01-abc"});
        when(container.getLabels()).thenReturn(Map.of(ContainerLabels.SESSION, "abc"));
        when(listCmd.exec()).thenReturn(List.of(container));

        List<ManagedContainer> managed = engine.listManaged();

        assertEquals(1, managed.size());
        assertEquals("dvc-xss-01-abc", managed.get(0).name());
        assertEquals("abc", managed.get(0).sessionId());
        verify(listCmd).withShowAll(true);
        verify(listCmd).withLabelFilter(List.of(ContainerLabels.SESSION));
    }

    @Test
    @DisplayName("version wraps daemon failures")
    void version() {
        var versionCmd = mock(VersionCmd.class);
        when(dockerClient.versionCmd()).thenReturn(versionCmd);
        var version = mock(Version.class);
        when(version.getVersion()).thenReturn("27.1.1");
        when(versionCmd.exec()).thenReturn(version).thenThrow(new RuntimeException("connection refused"));

        assertEquals("27.1.1", engine.version());
        assertThrows(ContainerEngineException.class, () -> engine.version());
    }

    // -- Helpers ---------------------------------------------------------

    private CreateContainerCmd mockCreateContainerCmd(String containerId) {
        var createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(createCmd);

        var createResponse = mock(CreateContainerResponse.class);
        when(createResponse.getId()).thenReturn(containerId);
        when(createCmd.exec()).thenReturn(createResponse);

        return createCmd;
    }

    private RemoveContainerCmd mockRemoveContainerCmd(String containerId) {
        var removeCmd = mock(RemoveContainerCmd.class, RETURNS_SELF);
        when(dockerClient.removeContainerCmd(containerId)).thenReturn(removeCmd);
        return removeCmd;
    }

    private void mockInspectContainer(String containerId, Map<String, String> bindings) {
        var ports = new Ports();
        bindings.forEach((exposed, hostPort) ->
                ports.bind(ExposedPort.parse(exposed), Ports.Binding.bindPort(Integer.parseInt(hostPort))));
        var settings = mock(NetworkSettings.class);
        when(settings.getPorts()).thenReturn(ports);
        var response = mock(InspectContainerResponse.class);
        when(response.getNetworkSettings()).thenReturn(settings);
        var inspectCmd = mock(InspectContainerCmd.class);
        when(inspectCmd.exec()).thenReturn(response);
        when(dockerClient.inspectContainerCmd(containerId)).thenReturn(inspectCmd);
    }

    private void mockInspectImageSuccess() {
        var inspectCmd = mock(InspectImageCmd.class);
        when(dockerClient.inspectImageCmd(anyString())).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenReturn(mock(InspectImageResponse.class));
    }
}

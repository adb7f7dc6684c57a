package com.dvc.container;

import com.dvc.core.security.SecurityProfile;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.NetworkSettings;
import com.github.dockerjava.api.model.Ports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link ContainerEngine} backed by the local Docker daemon.
 *
 * <p>Each challenge container is created with:
 * <ul>
 *   <li>the capability drop/add lists and {@code no-new-privileges} of its security profile</li>
 *   <li>a read-only root filesystem with tmpfs scratch mounts</li>
 *   <li>a non-root user, never privileged</li>
 *   <li>memory, NanoCPU and pids limits</li>
 *   <li>the configured network (bridge by default) and the requested port bindings</li>
 * </ul>
 * The image is pulled when it is not present locally.
 */
public class DockerContainerEngine implements ContainerEngine {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerEngine.class);

    /** Container ports tried in order when choosing the access URL. */
    static final List<String> PREFERRED_PORTS = List.of("80/tcp", "8080/tcp", "3000/tcp", "5000/tcp");

    private final DockerClient dockerClient;
    private final String accessHost;
    private final String network;
    private final Duration stopTimeout;
    private final Duration pullTimeout;

    public DockerContainerEngine(DockerClient dockerClient, String accessHost, String network,
                                 Duration stopTimeout, Duration pullTimeout) {
        this.dockerClient = dockerClient;
        this.accessHost = accessHost != null ? accessHost : "localhost";
        this.network = network != null ? network : "bridge";
        this.stopTimeout = stopTimeout;
        this.pullTimeout = pullTimeout;
    }

    @Override
    public ContainerHandle createAndStart(ContainerRequest request) {
        ensureImage(request.image());

        String containerId = null;
        try {
            var response = dockerClient.createContainerCmd(request.image())
                    .withName(request.name())
                    .withEnv(toEnvList(request.environment()))
                    .withLabels(request.labels())
                    .withExposedPorts(exposedPorts(request.ports()))
                    .withUser(request.profile().user())
                    .withHostConfig(hostConfig(request))
                    .exec();
            containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();

            Map<String, Integer> hostPorts = boundPorts(dockerClient.inspectContainerCmd(containerId).exec());
            String accessUrl = accessUrl(hostPorts);
            log.info("Container {} started ({}) for image {}, access {}",
                    request.name(), containerId, request.image(), accessUrl);
            return new ContainerHandle(containerId, request.name(), hostPorts, accessUrl);
        } catch (RuntimeException e) {
            String cleanupTarget = containerId != null ? containerId : request.name();
            discard(cleanupTarget);
            throw new ContainerEngineException("Failed to start container " + request.name()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop(String containerId) {
        try {
            dockerClient.stopContainerCmd(containerId)
                    .withTimeout((int) stopTimeout.toSeconds())
                    .exec();
        } catch (NotModifiedException e) {
            log.debug("Container {} already stopped", containerId);
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(containerId, e);
        } catch (RuntimeException e) {
            throw new ContainerEngineException("Failed to stop container " + containerId, e);
        }
    }

    @Override
    public void remove(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId)
                    .withForce(true)
                    .withRemoveVolumes(true)
                    .exec();
            log.info("Container {} removed", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (RuntimeException e) {
            throw new ContainerEngineException("Failed to remove container " + containerId, e);
        }
    }

    @Override
    public EngineHealth inspectHealth(String containerId) {
        InspectContainerResponse response;
        try {
            response = dockerClient.inspectContainerCmd(containerId).exec();
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(containerId, e);
        } catch (RuntimeException e) {
            throw new ContainerEngineException("Failed to inspect container " + containerId, e);
        }
        var state = response.getState();
        if (state == null) {
            return EngineHealth.UNKNOWN;
        }
        if (!Boolean.TRUE.equals(state.getRunning())) {
            return EngineHealth.UNHEALTHY;
        }
        var health = state.getHealth();
        if (health == null || health.getStatus() == null) {
            return EngineHealth.HEALTHY;
        }
        return switch (health.getStatus().toLowerCase()) {
            case "healthy" -> EngineHealth.HEALTHY;
            case "unhealthy" -> EngineHealth.UNHEALTHY;
            case "starting" -> EngineHealth.STARTING;
            case "none" -> EngineHealth.NONE;
            default -> EngineHealth.UNKNOWN;
        };
    }

    @Override
    public void restart(String containerId) {
        try {
            dockerClient.restartContainerCmd(containerId).exec();
            log.info("Container {} restarted", containerId);
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(containerId, e);
        } catch (RuntimeException e) {
            throw new ContainerEngineException("Failed to restart container " + containerId, e);
        }
    }

    @Override
    public List<ManagedContainer> listManaged() {
        try {
            List<Container> containers = dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withLabelFilter(List.of(ContainerLabels.SESSION))
                    .exec();
            var result = new ArrayList<ManagedContainer>();
            for (Container container : containers) {
                String[] names = container.getNames();
                String name = names != null && names.length > 0 ? stripSlash(names[0]) : container.getId();
                result.add(new ManagedContainer(container.getId(), name, container.getLabels()));
            }
            return result;
        } catch (RuntimeException e) {
            throw new ContainerEngineException("Failed to list challenge containers", e);
        }
    }

    @Override
    public String version() {
        try {
            return dockerClient.versionCmd().exec().getVersion();
        } catch (RuntimeException e) {
            throw new ContainerEngineException("Docker daemon unreachable: " + e.getMessage(), e);
        }
    }

    private void ensureImage(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            log.info("Image {} not present locally, pulling", image);
        }
        try {
            boolean done = dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(pullTimeout.toSeconds(), TimeUnit.SECONDS);
            if (!done) {
                throw new ContainerEngineException("Timed out pulling image " + image);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerEngineException("Interrupted while pulling image " + image, e);
        } catch (ContainerEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ContainerEngineException("Failed to pull image " + image + ": " + e.getMessage(), e);
        }
    }

    HostConfig hostConfig(ContainerRequest request) {
        SecurityProfile profile = request.profile();
        var limits = request.limits();
        long memoryBytes = (long) limits.memoryMb() * 1024 * 1024;

        var portBindings = new Ports();
        request.ports().forEach((containerPort, hostPort) -> portBindings.bind(
                ExposedPort.parse(containerPort),
                hostPort == null || hostPort == 0 ? Ports.Binding.empty() : Ports.Binding.bindPort(hostPort)));

        return HostConfig.newHostConfig()
                .withPortBindings(portBindings)
                .withMemory(memoryBytes)
                .withMemorySwap(memoryBytes)
                .withNanoCPUs((long) (limits.cpus() * 1_000_000_000L))
                .withPidsLimit((long) limits.pidsLimit())
                .withCapDrop(capabilities(profile.capDrop()))
                .withCapAdd(capabilities(profile.capAdd()))
                .withReadonlyRootfs(profile.readOnlyRootfs())
                .withTmpFs(profile.tmpfs())
                .withSecurityOpts(profile.noNewPrivileges() ? List.of("no-new-privileges:true") : List.of())
                .withNetworkMode(network)
                .withPrivileged(false);
    }

    /**
     * Picks the URL users reach the challenge on: the first preferred port
     * that is published, otherwise the first published port.
     */
    String accessUrl(Map<String, Integer> hostPorts) {
        if (hostPorts.isEmpty()) {
            return null;
        }
        for (String preferred : PREFERRED_PORTS) {
            Integer hostPort = hostPorts.get(preferred);
            if (hostPort != null) {
                return "http://" + accessHost + ":" + hostPort;
            }
        }
        return "http://" + accessHost + ":" + hostPorts.values().iterator().next();
    }

    private static Map<String, Integer> boundPorts(InspectContainerResponse response) {
        Map<String, Integer> result = new LinkedHashMap<>();
        NetworkSettings settings = response.getNetworkSettings();
        if (settings == null || settings.getPorts() == null) {
            return result;
        }
        settings.getPorts().getBindings().forEach((exposed, bindings) -> {
            if (bindings == null) {
                return;
            }
            for (Ports.Binding binding : bindings) {
                String spec = binding.getHostPortSpec();
                if (spec != null && !spec.isBlank()) {
                    try {
                        result.putIfAbsent(exposed.toString(), Integer.parseInt(spec));
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring non-numeric host port {} for {}", spec, exposed);
                    }
                }
            }
        });
        return result;
    }

    private void discard(String container) {
        try {
            dockerClient.removeContainerCmd(container).withForce(true).exec();
            log.debug("Removed half-created container {}", container);
        } catch (NotFoundException e) {
            log.debug("Nothing to clean up for {}", container);
        } catch (RuntimeException e) {
            log.warn("Failed to clean up container {}: {}", container, e.getMessage());
        }
    }

    private static List<ExposedPort> exposedPorts(Map<String, Integer> ports) {
        return ports.keySet().stream().map(ExposedPort::parse).toList();
    }

    private static List<String> toEnvList(Map<String, String> environment) {
        var env = new ArrayList<String>();
        environment.forEach((k, v) -> env.add(k + "=" + v));
        return env;
    }

    private static Capability[] capabilities(List<String> names) {
        return names.stream().map(Capability::valueOf).toArray(Capability[]::new);
    }

    private static String stripSlash(String name) {
        return name.startsWith("/") ? name.substring(1) : name;
    }
}

package com.playfactory.provisioning;

import com.playfactory.core.error.BuildFailedException;
import com.playfactory.core.error.GameFactoryException;
import com.playfactory.core.error.LaunchFailedException;
import com.playfactory.core.error.ResourceExhaustedException;
import com.playfactory.core.error.ServerNotFoundException;
import com.playfactory.core.logging.MdcContext;
import com.playfactory.core.metrics.FactoryMetrics;
import com.playfactory.core.model.GameServerInstance;
import com.playfactory.core.model.ResourceUsage;
import com.playfactory.core.model.ServerLogs;
import com.playfactory.core.model.ServerStatus;
import com.playfactory.registry.ServerLifecycleRegistry;
import com.playfactory.runtime.BuildDescriptor;
import com.playfactory.runtime.ContainerLaunch;
import com.playfactory.runtime.ContainerNotFoundException;
import com.playfactory.runtime.ContainerRuntime;
import com.playfactory.runtime.ContainerRuntimeException;
import com.playfactory.runtime.ContainerState;
import com.playfactory.runtime.ContainerStats;
import com.playfactory.runtime.RuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns user game code into a running game server container and manages it afterwards.
 *
 * <p>The pipeline runs validate, admit, scaffold, build, allocate, launch, record. Runtime calls
 * happen outside the registry lock, and nothing is recorded until the launch has succeeded, so a
 * failed attempt leaves no record and no port lease behind.
 */
@Service
public class GameServerManager {

    private static final Logger log = LoggerFactory.getLogger(GameServerManager.class);

    static final String CONTAINER_PREFIX = "game-server-";
    static final String CONTAINER_LOG_PREFIX = "[container] ";

    private final ServerLifecycleRegistry registry;
    private final PortAllocator portAllocator;
    private final AdmissionController admissionController;
    private final UserCodeInspector inspector;
    private final ServerScaffold scaffold;
    private final ContainerRuntime runtime;
    private final FactoryProperties properties;
    private final RuntimeProperties runtimeProperties;
    private final FactoryMetrics metrics;
    private final Clock clock;

    public GameServerManager(ServerLifecycleRegistry registry,
                             PortAllocator portAllocator,
                             AdmissionController admissionController,
                             UserCodeInspector inspector,
                             ServerScaffold scaffold,
                             ContainerRuntime runtime,
                             FactoryProperties properties,
                             RuntimeProperties runtimeProperties,
                             FactoryMetrics metrics,
                             Clock clock) {
        this.registry = registry;
        this.portAllocator = portAllocator;
        this.admissionController = admissionController;
        this.inspector = inspector;
        this.scaffold = scaffold;
        this.runtime = runtime;
        this.properties = properties;
        this.runtimeProperties = runtimeProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Builds and launches a game server from user code.
     *
     * @return the RUNNING instance as recorded
     * @throws com.playfactory.core.error.InvalidInputException     if the request is rejected
     * @throws ResourceExhaustedException                           if admission is denied
     * @throws BuildFailedException                                 if the image build fails
     * @throws com.playfactory.core.error.NoPortAvailableException  if the port range is exhausted
     * @throws LaunchFailedException                                if the container cannot be started
     */
    public GameServerInstance provision(String userCode, String name, String description) {
        long start = System.currentTimeMillis();
        try {
            GameServerInstance instance = runPipeline(userCode, name, description);
            metrics.recordProvisioning("success", System.currentTimeMillis() - start);
            return instance;
        } catch (GameFactoryException e) {
            metrics.recordProvisioning(e.code().name().toLowerCase(Locale.ROOT), System.currentTimeMillis() - start);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private GameServerInstance runPipeline(String userCode, String name, String description) {
        inspector.validate(userCode, name, description);

        AdmissionDecision decision = admissionController.canAdmit();
        if (!decision.allowed()) {
            throw new ResourceExhaustedException(decision.reason());
        }

        String serverId = newServerId(name);
        MdcContext.setOperation(serverId, "provision");
        GameServerInstance instance = GameServerInstance.provisioning(serverId, name, description, clock.instant());
        instance = log(instance, "Provisioning started");
        log.info("Provisioning server {} ('{}')", serverId, name);

        DeployableUnit unit = scaffold.wrap(userCode, name);
        Map<String, String> labels = labels(serverId, name);

        String imageRef;
        try {
            imageRef = runtime.buildImage(new BuildDescriptor(
                    runtimeProperties.getImagePrefix() + ":" + serverId,
                    scaffold.buildDescriptor(unit, name),
                    unit.files(),
                    labels));
        } catch (ContainerRuntimeException e) {
            log.error("Image build failed for {}: {}", serverId, e.getMessage());
            throw new BuildFailedException(e.getMessage(), e);
        }
        instance = log(instance, "Image built: " + imageRef);

        int port;
        try {
            port = portAllocator.allocate();
        } catch (RuntimeException e) {
            discardImage(imageRef);
            throw e;
        }

        String containerRef = null;
        try {
            containerRef = launch(serverId, name, imageRef, port, labels);
            instance = instance.launched(containerRef, imageRef, port, clock.instant());
            instance = log(instance, "Container started on port " + port);
            registry.upsert(instance);
            log.info("Server {} running on port {} (container {})", serverId, port, shortRef(containerRef));
            return instance;
        } catch (RuntimeException e) {
            if (containerRef != null) {
                discardContainer(serverId, containerRef);
            }
            portAllocator.release(port);
            discardImage(imageRef);
            throw e;
        }
    }

    private String launch(String serverId, String name, String imageRef, int port, Map<String, String> labels) {
        var env = new LinkedHashMap<String, String>();
        env.put("PORT", String.valueOf(runtimeProperties.getContainerPort()));
        env.put("PUBLIC_PORT", String.valueOf(port));
        env.put("ROOM_NAME", name);
        env.put("SERVER_ID", serverId);
        env.put("MATCHMAKER_URL", properties.getMatchmakerUrl());
        try {
            return runtime.runContainer(new ContainerLaunch(imageRef, CONTAINER_PREFIX + serverId, port, env, labels,
                    properties.getContainerMemoryLimitMb(), properties.getContainerCpuLimit()));
        } catch (ContainerRuntimeException e) {
            log.error("Container launch failed for {}: {}", serverId, e.getMessage());
            throw new LaunchFailedException(e.getMessage(), e);
        }
    }

    /**
     * Stops a running server. Stopping a stopped or failed server changes nothing.
     */
    public GameServerInstance stop(String serverId) {
        MdcContext.setOperation(serverId, "stop");
        try {
            GameServerInstance current = registry.get(serverId);
            if (current.status() != ServerStatus.RUNNING) {
                log.debug("Stop of {} ignored in state {}", serverId, current.status());
                return current;
            }
            try {
                runtime.stop(current.containerRef());
            } catch (ContainerNotFoundException e) {
                log.warn("Container for {} is gone; marking stopped", serverId);
            } catch (ContainerRuntimeException e) {
                log.error("Failed to stop {}: {}", serverId, e.getMessage());
                return transitionFromRunning(serverId, ServerStatus.ERROR, "Stop failed: " + e.getMessage());
            }
            GameServerInstance stopped = transitionFromRunning(serverId, ServerStatus.STOPPED, "Server stopped");
            if (stopped.status() != ServerStatus.STOPPED) {
                log.warn("Server {} moved to {} while stopping", serverId, stopped.status());
                return stopped;
            }
            metrics.recordStop();
            log.info("Server {} stopped", serverId);
            return stopped;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stops the server if needed, removes its container and image and forgets it.
     */
    public void remove(String serverId) {
        MdcContext.setOperation(serverId, "remove");
        try {
            GameServerInstance current = registry.get(serverId);
            if (current.status() == ServerStatus.RUNNING) {
                stop(serverId);
                MdcContext.setOperation(serverId, "remove");
            }
            // only the caller that wins the delete may release what the record holds
            GameServerInstance removed = registry.delete(serverId);
            if (removed.containerRef() != null) {
                discardContainer(serverId, removed.containerRef());
            }
            if (removed.imageRef() != null) {
                discardImage(removed.imageRef());
            }
            if (removed.port() != null) {
                portAllocator.release(removed.port());
            }
            metrics.recordRemoval();
            log.info("Server {} removed", serverId);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Samples container resource usage. Falls back to the cached snapshot when the runtime
     * cannot be queried.
     */
    public ResourceUsage refreshStats(String serverId) {
        GameServerInstance current = registry.get(serverId);
        if (current.status() != ServerStatus.RUNNING || current.containerRef() == null) {
            return current.resourceUsage();
        }
        try {
            ContainerStats stats = runtime.stats(current.containerRef());
            Instant now = clock.instant();
            var usage = new ResourceUsage(stats.cpuPercent(), stats.memoryUsageMb(), stats.memoryLimitMb(),
                    stats.networkRxMb(), stats.networkTxMb(), now);
            registry.update(serverId, s -> s.withResourceUsage(usage, now));
            return usage;
        } catch (ContainerRuntimeException e) {
            log.warn("Stats unavailable for {}: {}", serverId, e.getMessage());
            return current.resourceUsage();
        }
    }

    /**
     * Returns the last {@code tail} lifecycle lines followed by up to {@code tail} container lines.
     */
    public ServerLogs fetchLogs(String serverId, int tail) {
        int limit = Math.max(1, tail);
        GameServerInstance current = registry.get(serverId);
        List<String> containerLines = current.containerLogs();
        boolean live = false;
        if (current.containerRef() != null) {
            try {
                containerLines = runtime.logs(current.containerRef(), limit);
                live = true;
                List<String> fetched = containerLines;
                registry.update(serverId, s -> s.withContainerLogs(fetched, clock.instant()));
            } catch (ContainerRuntimeException e) {
                log.warn("Container logs unavailable for {}, using cached lines: {}", serverId, e.getMessage());
            }
        }
        var lines = new ArrayList<String>(tail(current.logs(), limit));
        for (String line : tail(containerLines, limit)) {
            lines.add(CONTAINER_LOG_PREFIX + line);
        }
        return new ServerLogs(serverId, lines, current.containerRef(), live);
    }

    /**
     * Moves a RUNNING server to ERROR when its container has exited or disappeared.
     */
    public GameServerInstance refreshStatus(String serverId) {
        MdcContext.setServer(serverId);
        try {
            return checkContainer(serverId);
        } finally {
            MdcContext.clear();
        }
    }

    private GameServerInstance checkContainer(String serverId) {
        GameServerInstance current = registry.get(serverId);
        if (current.status() != ServerStatus.RUNNING || current.containerRef() == null) {
            return current;
        }
        ContainerState state;
        try {
            state = runtime.inspect(current.containerRef());
        } catch (ContainerRuntimeException e) {
            log.warn("Cannot inspect container of {}: {}", serverId, e.getMessage());
            return current;
        }
        if (state == ContainerState.EXITED || state == ContainerState.MISSING) {
            GameServerInstance updated = transitionFromRunning(serverId, ServerStatus.ERROR,
                    "Container " + state.name().toLowerCase(Locale.ROOT));
            if (updated.status() == ServerStatus.ERROR) {
                log.warn("Container of {} is {}; marking server as failed", serverId, state);
                metrics.recordContainerFailure();
            }
            return updated;
        }
        return current;
    }

    /**
     * Records activity reported for a server, resetting its idle clock.
     *
     * @param connections players currently connected; a server with connections is never idle
     */
    public GameServerInstance recordActivity(String serverId, int connections) {
        return registry.update(serverId, s -> s.withActivity(connections, clock.instant()));
    }

    /**
     * Running servers with no connections and no activity for longer than the idle timeout.
     * Empty when the timeout is zero or negative.
     */
    public List<GameServerInstance> idleServers() {
        if (properties.getIdleTimeoutSeconds() <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        Duration timeout = Duration.ofSeconds(properties.getIdleTimeoutSeconds());
        return registry.list().stream()
                .filter(s -> s.isIdle(now, timeout))
                .toList();
    }

    /**
     * Idle servers with how long each has been idle, for the system endpoint.
     */
    public Map<String, Object> idleSummary() {
        Instant now = clock.instant();
        var servers = new ArrayList<Map<String, Object>>();
        for (GameServerInstance idle : idleServers()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("server_id", idle.serverId());
            entry.put("container_ref", shortRef(idle.containerRef()));
            entry.put("last_activity", idle.lastActivity().toString());
            entry.put("connection_count", idle.connections());
            entry.put("idle_seconds", Duration.between(idle.lastActivity(), now).getSeconds());
            servers.add(entry);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("timestamp", now.toString());
        summary.put("count", servers.size());
        summary.put("idle_timeout_seconds", properties.getIdleTimeoutSeconds());
        summary.put("servers", servers);
        return summary;
    }

    /**
     * Stops every idle server. Returns the ids that ended up STOPPED.
     */
    public List<String> reclaimIdle() {
        var stopped = new ArrayList<String>();
        for (GameServerInstance idle : idleServers()) {
            try {
                log.info("Stopping idle server {} (idle longer than {}s)", idle.serverId(),
                        properties.getIdleTimeoutSeconds());
                if (stop(idle.serverId()).status() == ServerStatus.STOPPED) {
                    stopped.add(idle.serverId());
                }
            } catch (ServerNotFoundException e) {
                log.debug("Idle server {} removed before it could be stopped", idle.serverId());
            }
        }
        return stopped;
    }

    public GameServerInstance describe(String serverId) {
        refreshStatus(serverId);
        refreshStats(serverId);
        return registry.get(serverId);
    }

    public List<GameServerInstance> list() {
        return registry.list();
    }

    /**
     * Aggregate view of capacity: server counts, reserved and observed resources, ceilings.
     */
    public Map<String, Object> resourceSummary() {
        List<GameServerInstance> servers = registry.list();
        Map<ServerStatus, Integer> counts = registry.countByStatus();
        var byStatus = new LinkedHashMap<String, Integer>();
        for (ServerStatus status : ServerStatus.values()) {
            if (status != ServerStatus.REMOVED) {
                byStatus.put(status.name().toLowerCase(Locale.ROOT), counts.getOrDefault(status, 0));
            }
        }
        double observedCpu = 0;
        double observedMemory = 0;
        int active = 0;
        for (GameServerInstance server : servers) {
            if (server.status().holdsPort()) {
                active++;
                observedCpu += server.resourceUsage().cpuPercent();
                observedMemory += server.resourceUsage().memoryMb();
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_servers", servers.size());
        summary.put("servers_by_status", byStatus);
        summary.put("reserved_memory_mb", (long) active * properties.getContainerMemoryLimitMb());
        summary.put("reserved_cpus", active * properties.getContainerCpuLimit());
        summary.put("observed_cpu_percent", observedCpu);
        summary.put("observed_memory_mb", observedMemory);
        summary.put("leased_ports", portAllocator.leasedCount());
        summary.put("port_range", portAllocator.rangeStart() + "-" + portAllocator.rangeEnd());

        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("max_containers", properties.getMaxContainers());
        limits.put("container_memory_limit_mb", properties.getContainerMemoryLimitMb());
        limits.put("container_cpu_limit", properties.getContainerCpuLimit());
        limits.put("max_reserved_memory_mb", properties.getMaxReservedMemoryMb());
        limits.put("max_reserved_cpus", properties.getMaxReservedCpus());
        limits.put("max_observed_cpu_percent", properties.getMaxObservedCpuPercent());
        summary.put("limits", limits);

        AdmissionDecision decision = admissionController.canAdmit();
        summary.put("can_create_server", decision.allowed());
        summary.put("admission_reason", decision.reason());
        return summary;
    }

    /**
     * Applies {@code next} only if the stored server is still RUNNING. A concurrent stop or
     * failure may have moved it already; the stored copy is then returned unchanged.
     */
    private GameServerInstance transitionFromRunning(String serverId, ServerStatus next, String line) {
        return registry.update(serverId, s -> {
            if (s.status() != ServerStatus.RUNNING) {
                return s;
            }
            Instant now = clock.instant();
            return s.withStatus(next, now).withLog(stamp(now, line), properties.getLogRetention(), now);
        });
    }

    private GameServerInstance log(GameServerInstance instance, String line) {
        Instant now = clock.instant();
        return instance.withLog(stamp(now, line), properties.getLogRetention(), now);
    }

    private void discardContainer(String serverId, String containerRef) {
        try {
            runtime.remove(containerRef);
        } catch (ContainerRuntimeException e) {
            log.warn("Could not remove container of {}: {}", serverId, e.getMessage());
        }
    }

    private void discardImage(String imageRef) {
        try {
            runtime.removeImage(imageRef);
        } catch (ContainerRuntimeException e) {
            log.warn("Could not remove image {}: {}", imageRef, e.getMessage());
        }
    }

    private static Map<String, String> labels(String serverId, String name) {
        var labels = new LinkedHashMap<String, String>();
        labels.put("created_by", "playfactory");
        labels.put("server_id", serverId);
        labels.put("server_name", name);
        return labels;
    }

    private static String stamp(Instant now, String line) {
        return "[" + now + "] " + line;
    }

    private static List<String> tail(List<String> lines, int limit) {
        return lines.size() <= limit ? lines : lines.subList(lines.size() - limit, lines.size());
    }

    private static String shortRef(String ref) {
        return ref.length() > 12 ? ref.substring(0, 12) : ref;
    }

    /**
     * Ids look like {@code gs-space-race-3fa2b81c}: a lower-cased slug of the name plus random hex.
     */
    static String newServerId(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        if (slug.length() > 24) {
            slug = slug.substring(0, 24).replaceAll("-+$", "");
        }
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return slug.isEmpty() ? "gs-" + suffix : "gs-" + slug + "-" + suffix;
    }
}

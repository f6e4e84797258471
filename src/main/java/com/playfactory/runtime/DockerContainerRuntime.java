package com.playfactory.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.*;
import com.github.dockerjava.core.InvocationBuilder;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Docker-based ContainerRuntime.
 *
 * <p>Images are built from a temporary build context holding the descriptor's files and
 * Dockerfile. Containers are attached to the configured bridge network, publish the game
 * port on the requested host port and get memory and CPU limits from the launch request.
 * Containers are never restarted by the daemon; a crashed game server stays exited so the
 * factory can mark it as failed.
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    private static final double MB = 1024.0 * 1024.0;

    private final DockerClient dockerClient;
    private final RuntimeProperties properties;

    public DockerContainerRuntime(DockerClient dockerClient, RuntimeProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    /**
     * Creates the game network if the daemon does not have it yet.
     */
    public void ensureNetwork() {
        String network = properties.getNetwork();
        try {
            boolean exists = dockerClient.listNetworksCmd().withNameFilter(network).exec().stream()
                    .anyMatch(n -> network.equals(n.getName()));
            if (exists) {
                log.info("Docker network '{}' already exists", network);
                return;
            }
            dockerClient.createNetworkCmd()
                    .withName(network)
                    .withDriver("bridge")
                    .withLabels(Map.of("created_by", "playfactory"))
                    .exec();
            log.info("Created Docker network '{}'", network);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Failed to ensure network " + network + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String buildImage(BuildDescriptor descriptor) {
        Path context = null;
        try {
            context = Files.createTempDirectory("playfactory-build-");
            for (var file : descriptor.files().entrySet()) {
                Path target = context.resolve(file.getKey());
                Files.createDirectories(target.getParent());
                Files.writeString(target, file.getValue(), StandardCharsets.UTF_8);
            }
            Files.writeString(context.resolve("Dockerfile"), descriptor.dockerfile(), StandardCharsets.UTF_8);

            log.info("Building image {}", descriptor.imageTag());
            String imageId = dockerClient.buildImageCmd(context.toFile())
                    .withTags(Set.of(descriptor.imageTag()))
                    .withLabels(descriptor.labels())
                    .withRemove(true)
                    .withForcerm(true)
                    .exec(new BuildImageResultCallback())
                    .awaitImageId(properties.getBuildTimeoutSeconds(), TimeUnit.SECONDS);
            log.info("Image {} built ({})", descriptor.imageTag(), imageId);
            return descriptor.imageTag();
        } catch (IOException e) {
            throw new ContainerRuntimeException("Failed to prepare build context: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(e.getMessage(), e);
        } finally {
            if (context != null) {
                deleteRecursively(context);
            }
        }
    }

    @Override
    public String runContainer(ContainerLaunch launch) {
        // A container left over from an earlier attempt would block the name
        try {
            dockerClient.removeContainerCmd(launch.containerName()).withForce(true).exec();
            log.debug("Removed stale container {}", launch.containerName());
        } catch (NotFoundException e) {
            log.trace("No stale container named {}", launch.containerName());
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Daemon rejected cleanup of " + launch.containerName() + ": " + e.getMessage(), e);
        }

        var exposed = ExposedPort.tcp(properties.getContainerPort());
        var portBindings = new Ports();
        portBindings.bind(exposed, Ports.Binding.bindPort(launch.hostPort()));

        var hostConfig = HostConfig.newHostConfig()
                .withPortBindings(portBindings)
                .withMemory((long) launch.memoryLimitMb() * 1024 * 1024)
                .withNanoCPUs((long) (launch.cpuLimit() * 1_000_000_000L))
                .withNetworkMode(properties.getNetwork())
                .withRestartPolicy(RestartPolicy.noRestart());

        var envList = new ArrayList<String>();
        launch.env().forEach((k, v) -> envList.add(k + "=" + v));

        String containerId;
        try {
            containerId = dockerClient.createContainerCmd(launch.imageRef())
                    .withName(launch.containerName())
                    .withExposedPorts(exposed)
                    .withHostConfig(hostConfig)
                    .withEnv(envList)
                    .withLabels(launch.labels())
                    .exec()
                    .getId();
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Create failed for " + launch.containerName() + ": " + e.getMessage(), e);
        }

        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            try {
                dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new ContainerRuntimeException("Start failed for " + launch.containerName() + ": " + e.getMessage(), e);
        }
        log.info("Container {} started ({}) on host port {}", launch.containerName(), containerId, launch.hostPort());
        return containerId;
    }

    @Override
    public void stop(String containerRef) {
        try {
            dockerClient.stopContainerCmd(containerRef).withTimeout(properties.getStopTimeoutSeconds()).exec();
            log.info("Container {} stopped", containerRef);
        } catch (NotModifiedException e) {
            log.debug("Container {} was already stopped", containerRef);
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(containerRef, e);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Stop failed for " + containerRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void remove(String containerRef) {
        try {
            dockerClient.removeContainerCmd(containerRef).withForce(true).exec();
            log.info("Container {} removed", containerRef);
        } catch (NotFoundException e) {
            log.debug("Container {} already gone", containerRef);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Remove failed for " + containerRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void removeImage(String imageRef) {
        try {
            dockerClient.removeImageCmd(imageRef).withForce(true).exec();
            log.info("Image {} removed", imageRef);
        } catch (NotFoundException e) {
            log.debug("Image {} already gone", imageRef);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Image removal failed for " + imageRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ContainerStats stats(String containerRef) {
        try (var callback = new InvocationBuilder.AsyncResultCallback<Statistics>()) {
            dockerClient.statsCmd(containerRef).withNoStream(true).exec(callback);
            Statistics statistics = callback.awaitResult();
            if (statistics == null) {
                throw new ContainerRuntimeException("No statistics returned for " + containerRef);
            }
            return toStats(statistics);
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(containerRef, e);
        } catch (IOException e) {
            throw new ContainerRuntimeException("Stats stream failed for " + containerRef, e);
        } catch (ContainerRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Stats failed for " + containerRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> logs(String containerRef, int tail) {
        var lines = new ArrayList<String>();
        var partial = new StringBuilder();
        boolean completed;
        try {
            completed = dockerClient.logContainerCmd(containerRef)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withTimestamps(true)
                    .withTail(tail)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            partial.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(properties.getLogTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerRuntimeException("Interrupted while reading logs of " + containerRef, e);
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(containerRef, e);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Logs failed for " + containerRef + ": " + e.getMessage(), e);
        }
        if (!completed) {
            throw new ContainerRuntimeException("Timed out after " + properties.getLogTimeoutSeconds()
                    + "s reading logs of " + containerRef);
        }
        for (String line : partial.toString().split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.stripTrailing());
            }
        }
        return lines;
    }

    @Override
    public ContainerState inspect(String containerRef) {
        try {
            var state = dockerClient.inspectContainerCmd(containerRef).exec().getState();
            if (Boolean.TRUE.equals(state.getRunning())) {
                return ContainerState.RUNNING;
            }
            if (Boolean.TRUE.equals(state.getRestarting()) || "created".equals(state.getStatus())) {
                return ContainerState.STARTING;
            }
            return ContainerState.EXITED;
        } catch (NotFoundException e) {
            return ContainerState.MISSING;
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Inspect failed for " + containerRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void ping() {
        try {
            dockerClient.pingCmd().exec();
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("Docker daemon unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * CPU percent follows the docker CLI: usage delta over system delta, scaled by online CPUs.
     */
    static ContainerStats toStats(Statistics statistics) {
        double cpuPercent = 0.0;
        var cpu = statistics.getCpuStats();
        var preCpu = statistics.getPreCpuStats();
        if (cpu != null && preCpu != null && cpu.getCpuUsage() != null && preCpu.getCpuUsage() != null) {
            long cpuDelta = orZero(cpu.getCpuUsage().getTotalUsage()) - orZero(preCpu.getCpuUsage().getTotalUsage());
            long systemDelta = orZero(cpu.getSystemCpuUsage()) - orZero(preCpu.getSystemCpuUsage());
            long onlineCpus = orZero(cpu.getOnlineCpus());
            if (onlineCpus == 0 && cpu.getCpuUsage().getPercpuUsage() != null) {
                onlineCpus = cpu.getCpuUsage().getPercpuUsage().size();
            }
            if (systemDelta > 0 && cpuDelta > 0) {
                cpuPercent = (double) cpuDelta / systemDelta * Math.max(1, onlineCpus) * 100.0;
            }
        }

        double memoryUsage = 0;
        double memoryLimit = 0;
        if (statistics.getMemoryStats() != null) {
            memoryUsage = orZero(statistics.getMemoryStats().getUsage());
            memoryLimit = orZero(statistics.getMemoryStats().getLimit());
        }

        long rx = 0;
        long tx = 0;
        if (statistics.getNetworks() != null) {
            for (var network : statistics.getNetworks().values()) {
                rx += orZero(network.getRxBytes());
                tx += orZero(network.getTxBytes());
            }
        }

        return new ContainerStats(round(cpuPercent), round(memoryUsage / MB), round(memoryLimit / MB),
                round(rx / MB), round(tx / MB));
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static void deleteRecursively(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete build context file {}", p);
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up build context {}", root);
        }
    }
}

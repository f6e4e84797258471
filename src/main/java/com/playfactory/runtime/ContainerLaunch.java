package com.playfactory.runtime;

import java.util.Map;

/**
 * Request to start a container from a built image.
 *
 * @param containerName  name to give the container
 * @param hostPort       host port to publish the game server on
 * @param memoryLimitMb  hard memory limit
 * @param cpuLimit       CPU quota in cores
 */
public record ContainerLaunch(
    String imageRef,
    String containerName,
    int hostPort,
    Map<String, String> env,
    Map<String, String> labels,
    int memoryLimitMb,
    double cpuLimit
) {
    public ContainerLaunch {
        env = env != null ? Map.copyOf(env) : Map.of();
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }
}

package com.playfactory.runtime;

import java.util.List;

/**
 * Abstraction over the engine that builds and runs game server containers.
 * Implementations: DockerContainerRuntime.
 *
 * <p>Every call may block on the engine. Implementations own their timeouts and report
 * failures as {@link ContainerRuntimeException}.
 */
public interface ContainerRuntime {

    /**
     * Builds an image from the descriptor.
     * @return the image reference (tag) to launch from
     */
    String buildImage(BuildDescriptor descriptor);

    /**
     * Creates and starts a container.
     * @return the container reference
     */
    String runContainer(ContainerLaunch launch);

    /**
     * Stops a container. Stopping an already stopped container succeeds.
     * @throws ContainerNotFoundException if the container does not exist
     */
    void stop(String containerRef);

    /**
     * Removes a container, stopping it first if needed.
     */
    void remove(String containerRef);

    /**
     * Removes a built image.
     */
    void removeImage(String imageRef);

    ContainerStats stats(String containerRef);

    /**
     * Returns the last {@code tail} lines of container output, oldest first.
     */
    List<String> logs(String containerRef, int tail);

    ContainerState inspect(String containerRef);

    /**
     * Checks that the engine is reachable.
     */
    void ping();
}

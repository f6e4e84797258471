package com.playfactory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A game server provisioned by the factory.
 *
 * <p>Instances are immutable; the {@code with*} methods return updated copies with
 * {@code updatedAt} advanced. The lifecycle registry stores the current copy per id.
 *
 * @param containerRef  runtime handle, set only once a launch has succeeded
 * @param imageRef      tag of the image built for this server
 * @param logs          lifecycle log lines, oldest first, bounded to a retained tail
 * @param containerLogs the last container log tail fetched from the runtime
 * @param lastActivity  last time the server reported activity; launch counts as activity
 * @param connections   player connections reported with the last activity update
 */
public record GameServerInstance(
    @JsonProperty("server_id") String serverId,
    String name,
    String description,
    ServerStatus status,
    @JsonProperty("container_ref") String containerRef,
    @JsonProperty("image_ref") String imageRef,
    Integer port,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("resource_usage") ResourceUsage resourceUsage,
    List<String> logs,
    @JsonProperty("container_logs") List<String> containerLogs,
    @JsonProperty("last_activity") Instant lastActivity,
    @JsonProperty("connection_count") int connections
) {

    public GameServerInstance {
        logs = logs != null ? List.copyOf(logs) : List.of();
        containerLogs = containerLogs != null ? List.copyOf(containerLogs) : List.of();
        resourceUsage = resourceUsage != null ? resourceUsage : ResourceUsage.EMPTY;
        lastActivity = lastActivity != null ? lastActivity : createdAt;
    }

    /**
     * Creates the transient record held by the pipeline while a server is being provisioned.
     */
    public static GameServerInstance provisioning(String serverId, String name, String description, Instant now) {
        return new GameServerInstance(serverId, name, description, ServerStatus.PROVISIONING,
                null, null, null, now, now, ResourceUsage.EMPTY, List.of(), List.of(), now, 0);
    }

    public GameServerInstance withStatus(ServerStatus next, Instant now) {
        if (next != status && !status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + status + " -> " + next + " for " + serverId);
        }
        return new GameServerInstance(serverId, name, description, next, containerRef, imageRef, port,
                createdAt, now, resourceUsage, logs, containerLogs, lastActivity, connections);
    }

    /**
     * Records a successful launch: container and port are attached and the server is RUNNING.
     */
    public GameServerInstance launched(String containerRef, String imageRef, int port, Instant now) {
        return new GameServerInstance(serverId, name, description, ServerStatus.RUNNING, containerRef, imageRef,
                port, createdAt, now, resourceUsage, logs, containerLogs, now, connections);
    }

    public GameServerInstance withResourceUsage(ResourceUsage usage, Instant now) {
        return new GameServerInstance(serverId, name, description, status, containerRef, imageRef, port,
                createdAt, now, usage, logs, containerLogs, lastActivity, connections);
    }

    public GameServerInstance withContainerLogs(List<String> lines, Instant now) {
        return new GameServerInstance(serverId, name, description, status, containerRef, imageRef, port,
                createdAt, now, resourceUsage, logs, lines, lastActivity, connections);
    }

    public GameServerInstance withActivity(int connectionCount, Instant now) {
        return new GameServerInstance(serverId, name, description, status, containerRef, imageRef, port,
                createdAt, now, resourceUsage, logs, containerLogs, now, Math.max(0, connectionCount));
    }

    /**
     * A running server is idle once nobody is connected and no activity was reported for
     * longer than {@code timeout}.
     */
    public boolean isIdle(Instant now, Duration timeout) {
        return status == ServerStatus.RUNNING
                && connections == 0
                && Duration.between(lastActivity, now).compareTo(timeout) > 0;
    }

    /**
     * Appends a lifecycle log line, dropping the oldest lines beyond {@code retention}.
     */
    public GameServerInstance withLog(String line, int retention, Instant now) {
        var next = new ArrayList<String>(logs.size() + 1);
        next.addAll(logs);
        next.add(line);
        int overflow = next.size() - Math.max(1, retention);
        List<String> kept = overflow > 0 ? next.subList(overflow, next.size()) : next;
        return new GameServerInstance(serverId, name, description, status, containerRef, imageRef, port,
                createdAt, now, resourceUsage, kept, containerLogs, lastActivity, connections);
    }
}

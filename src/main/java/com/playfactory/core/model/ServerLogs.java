package com.playfactory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Log view returned for a game server: lifecycle lines followed by container output.
 *
 * @param live false when the runtime could not be reached and cached container lines were used
 */
public record ServerLogs(
    @JsonProperty("server_id") String serverId,
    List<String> logs,
    @JsonProperty("container_ref") String containerRef,
    boolean live
) {
    @JsonProperty("log_count")
    public int logCount() {
        return logs.size();
    }
}

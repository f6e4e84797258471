package com.playfactory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Last observed resource snapshot of a game server container.
 *
 * @param sampledAt when the runtime was last queried; null if it never was
 */
public record ResourceUsage(
    @JsonProperty("cpu_percent") double cpuPercent,
    @JsonProperty("memory_mb") double memoryMb,
    @JsonProperty("memory_limit_mb") double memoryLimitMb,
    @JsonProperty("network_rx_mb") double networkRxMb,
    @JsonProperty("network_tx_mb") double networkTxMb,
    @JsonProperty("sampled_at") Instant sampledAt
) {
    public static final ResourceUsage EMPTY = new ResourceUsage(0, 0, 0, 0, 0, null);
}

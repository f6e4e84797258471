package com.playfactory.matchmaker;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MatchmakerStatistics(
    @JsonProperty("active_servers") int activeServers,
    @JsonProperty("total_servers") int totalServers,
    @JsonProperty("total_players") int totalPlayers,
    @JsonProperty("heartbeat_timeout_seconds") long heartbeatTimeoutSeconds
) {}

package com.playfactory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A live game server as known to the matchmaker. Entries are replaced, never mutated.
 *
 * <p>Liveness is not stored: it is derived from {@code lastHeartbeat} each time it is asked for,
 * so an entry that lapsed between sweeps is already reported inactive.
 */
public record MatchmakerEntry(
    @JsonProperty("server_id") String serverId,
    String ip,
    int port,
    String name,
    @JsonProperty("max_players") int maxPlayers,
    @JsonProperty("current_players") int currentPlayers,
    Map<String, Object> metadata,
    @JsonProperty("registered_at") Instant registeredAt,
    @JsonProperty("last_heartbeat") Instant lastHeartbeat
) {

    public MatchmakerEntry {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public boolean isActive(Instant now, Duration heartbeatTimeout) {
        return Duration.between(lastHeartbeat, now).compareTo(heartbeatTimeout) < 0;
    }

    public Duration uptime(Instant now) {
        return Duration.between(registeredAt, now);
    }

    public MatchmakerEntry heartbeat(Integer players, Instant now) {
        return new MatchmakerEntry(serverId, ip, port, name, maxPlayers,
                players != null ? players : currentPlayers, metadata, registeredAt, now);
    }

    public MatchmakerEntry refreshed(String newName, int newMaxPlayers, int newCurrentPlayers,
                                     Map<String, Object> newMetadata, Instant now) {
        return new MatchmakerEntry(serverId, ip, port, newName, newMaxPlayers, newCurrentPlayers,
                newMetadata, registeredAt, now);
    }
}

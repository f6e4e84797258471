package com.playfactory.matchmaker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Registration sent by a game server when it comes up (and again whenever it lost its entry).
 *
 * @param serverId       preferred id; ignored when already taken by another address
 * @param maxPlayers     defaults to 20 when absent
 * @param currentPlayers defaults to 0 when absent
 */
public record ServerRegistration(
    @JsonProperty("server_id") String serverId,
    String ip,
    Integer port,
    String name,
    @JsonProperty("max_players") Integer maxPlayers,
    @JsonProperty("current_players") Integer currentPlayers,
    Map<String, Object> metadata
) {
    public static final int DEFAULT_MAX_PLAYERS = 20;

    public int maxPlayersOrDefault() {
        return maxPlayers != null ? maxPlayers : DEFAULT_MAX_PLAYERS;
    }

    public int currentPlayersOrDefault() {
        return currentPlayers != null ? currentPlayers : 0;
    }

    public String address() {
        return ip + ":" + port;
    }
}

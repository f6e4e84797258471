package com.playfactory.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of a matchmaker heartbeat.
 */
public record HeartbeatRequest(@JsonProperty("current_players") Integer currentPlayers) {}

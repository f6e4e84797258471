package com.playfactory.matchmaker;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.playfactory.core.model.MatchmakerEntry;

import java.time.Duration;
import java.time.Instant;

/**
 * A matchmaker entry as players see it in the room list, with liveness and uptime taken at
 * listing time.
 *
 * @param uptimeSeconds whole seconds since the server first registered
 */
public record ServerListing(
    @JsonUnwrapped MatchmakerEntry entry,
    @JsonProperty("is_active") boolean active,
    @JsonProperty("uptime") long uptimeSeconds
) {

    static ServerListing of(MatchmakerEntry entry, Instant now, Duration heartbeatTimeout) {
        return new ServerListing(entry, entry.isActive(now, heartbeatTimeout), entry.uptime(now).getSeconds());
    }
}

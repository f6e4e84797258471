package com.playfactory.core.error;

/**
 * Thrown by the matchmaker when an entry still exists but its heartbeat window has lapsed.
 * Distinct from {@link ServerNotFoundException}: the server existed and is awaiting eviction.
 */
public class ServerGoneException extends GameFactoryException {

    private final String serverId;

    public ServerGoneException(String serverId) {
        super(ErrorCode.GONE, "Server is inactive: " + serverId);
        this.serverId = serverId;
    }

    public String serverId() {
        return serverId;
    }
}

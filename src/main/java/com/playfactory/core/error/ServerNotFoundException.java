package com.playfactory.core.error;

/**
 * Thrown for an id that is unknown to the registry being queried.
 */
public class ServerNotFoundException extends GameFactoryException {

    private final String serverId;

    public ServerNotFoundException(String serverId) {
        super(ErrorCode.NOT_FOUND, "Server not found: " + serverId);
        this.serverId = serverId;
    }

    public String serverId() {
        return serverId;
    }
}

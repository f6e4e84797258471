package com.playfactory.core.model;

import java.util.Set;

/**
 * Lifecycle states of a provisioned game server.
 *
 * <p>PROVISIONING -> RUNNING -> (STOPPED | ERROR) -> REMOVED. There is no restart edge;
 * a stopped or failed server can only be removed.
 */
public enum ServerStatus {
    PROVISIONING,
    RUNNING,
    STOPPED,
    ERROR,
    REMOVED;

    /** States whose port must be unique across the registry. */
    public static final Set<ServerStatus> PORT_HOLDING = Set.of(PROVISIONING, RUNNING);

    public boolean holdsPort() {
        return PORT_HOLDING.contains(this);
    }

    public boolean canTransitionTo(ServerStatus next) {
        return switch (this) {
            case PROVISIONING -> next == RUNNING || next == ERROR || next == REMOVED;
            case RUNNING -> next == STOPPED || next == ERROR || next == REMOVED;
            case STOPPED, ERROR -> next == REMOVED;
            case REMOVED -> false;
        };
    }
}

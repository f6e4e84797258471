package com.playfactory.core.error;

/**
 * Thrown when admission control rejects a provisioning attempt. Callers may retry later.
 */
public class ResourceExhaustedException extends GameFactoryException {

    private final String reason;

    public ResourceExhaustedException(String reason) {
        super(ErrorCode.RESOURCE_EXHAUSTED, "Cannot create server: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}

package com.playfactory.core.error;

/**
 * Thrown when every port in the configured range is leased or bound.
 */
public class NoPortAvailableException extends GameFactoryException {
    public NoPortAvailableException(int rangeStart, int rangeEnd) {
        super(ErrorCode.NO_PORT_AVAILABLE, "No free ports in range " + rangeStart + "-" + rangeEnd);
    }
}

package com.playfactory.core.error;

public class LaunchFailedException extends GameFactoryException {
    public LaunchFailedException(String details, Throwable cause) {
        super(ErrorCode.LAUNCH_FAILED, "Container launch failed: " + details, cause);
    }
}

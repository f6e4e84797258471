package com.playfactory.core.error;

public class BuildFailedException extends GameFactoryException {
    public BuildFailedException(String details, Throwable cause) {
        super(ErrorCode.BUILD_FAILED, "Image build failed: " + details, cause);
    }
}

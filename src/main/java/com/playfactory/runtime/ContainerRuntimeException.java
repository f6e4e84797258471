package com.playfactory.runtime;

/**
 * Thrown when the container runtime fails or cannot be reached.
 */
public class ContainerRuntimeException extends RuntimeException {
    public ContainerRuntimeException(String message) {
        super(message);
    }

    public ContainerRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}

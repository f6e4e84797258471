package com.playfactory.runtime;

public class ContainerNotFoundException extends ContainerRuntimeException {
    public ContainerNotFoundException(String containerRef, Throwable cause) {
        super("Container not found: " + containerRef, cause);
    }
}

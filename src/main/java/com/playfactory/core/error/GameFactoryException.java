package com.playfactory.core.error;

/**
 * Base class for every failure the factory reports to its callers.
 * The {@link ErrorCode} lets the API layer map a failure to a response without
 * inspecting the concrete type.
 */
public abstract class GameFactoryException extends RuntimeException {

    private final ErrorCode code;

    protected GameFactoryException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected GameFactoryException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}

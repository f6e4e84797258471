package com.playfactory.core.error;

/**
 * Failure categories surfaced to callers of the provisioning pipeline and the matchmaker.
 */
public enum ErrorCode {
    INVALID_INPUT,
    RESOURCE_EXHAUSTED,
    NO_PORT_AVAILABLE,
    BUILD_FAILED,
    LAUNCH_FAILED,
    NOT_FOUND,
    GONE
}

package com.playfactory.runtime;

/**
 * Coarse container state as reported by the runtime.
 */
public enum ContainerState {
    RUNNING,
    /** Created or restarting; not yet serving. */
    STARTING,
    EXITED,
    /** The runtime has no container with the given reference. */
    MISSING
}

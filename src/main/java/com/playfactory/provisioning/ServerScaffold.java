package com.playfactory.provisioning;

/**
 * Wraps user game logic in a runnable server and describes how to containerise it.
 * Implementations are pure functions of their inputs.
 */
public interface ServerScaffold {

    DeployableUnit wrap(String userCode, String serverName);

    /**
     * Build instructions (a Dockerfile) for the unit returned by {@link #wrap}.
     */
    String buildDescriptor(DeployableUnit unit, String serverName);
}

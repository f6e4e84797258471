package com.playfactory.provisioning;

import java.util.Map;

/**
 * Source files of a runnable game server, keyed by path relative to the build context.
 *
 * @param entrypoint the file the server process starts from
 */
public record DeployableUnit(Map<String, String> files, String entrypoint) {

    public DeployableUnit {
        files = Map.copyOf(files);
    }
}

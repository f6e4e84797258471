package com.playfactory.runtime;

import java.util.Map;

/**
 * Everything needed to build a game server image.
 *
 * @param imageTag   tag to apply to the built image
 * @param dockerfile build instructions
 * @param files      build context files keyed by relative path
 * @param labels     labels applied to the image
 */
public record BuildDescriptor(
    String imageTag,
    String dockerfile,
    Map<String, String> files,
    Map<String, String> labels
) {
    public BuildDescriptor {
        files = Map.copyOf(files);
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }
}

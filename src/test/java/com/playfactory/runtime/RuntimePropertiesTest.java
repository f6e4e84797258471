package com.playfactory.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuntimePropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new RuntimeProperties();
        assertEquals("docker", props.getProvider());
        assertEquals("game-network", props.getNetwork());
        assertEquals("game-server", props.getImagePrefix());
        assertEquals(8080, props.getContainerPort());
        assertEquals(300, props.getBuildTimeoutSeconds());
        assertEquals(10, props.getStopTimeoutSeconds());
        assertEquals(30, props.getLogTimeoutSeconds());
    }
}

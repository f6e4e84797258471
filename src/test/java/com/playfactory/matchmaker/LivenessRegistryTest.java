package com.playfactory.matchmaker;

import com.playfactory.core.error.InvalidInputException;
import com.playfactory.core.error.ServerGoneException;
import com.playfactory.core.error.ServerNotFoundException;
import com.playfactory.core.metrics.FactoryMetrics;
import com.playfactory.core.model.MatchmakerEntry;
import com.playfactory.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LivenessRegistryTest {

    private MutableClock clock;
    private MatchmakerProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private LivenessRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T12:00:00Z");
        properties = new MatchmakerProperties();
        meterRegistry = new SimpleMeterRegistry();
        registry = new LivenessRegistry(clock, properties, new FactoryMetrics(meterRegistry));
    }

    private static ServerRegistration registration(String id, String ip, int port, String name) {
        return new ServerRegistration(id, ip, port, name, null, null, Map.of("game_type", "custom"));
    }

    @Test
    @DisplayName("Registered server is listed with defaults applied")
    void registerAndGet() {
        String id = registry.register(registration(null, "192.168.1.100", 8080, "X"));

        assertEquals("192.168.1.100:8080", id);
        MatchmakerEntry entry = registry.get(id);
        assertEquals("X", entry.name());
        assertEquals(20, entry.maxPlayers());
        assertEquals(0, entry.currentPlayers());
        assertEquals("custom", entry.metadata().get("game_type"));
        assertEquals(1, registry.list(true).size());
    }

    @Test
    @DisplayName("A caller-supplied id is kept when unused")
    void callerSuppliedId() {
        assertEquals("gs-space-1234", registry.register(registration("gs-space-1234", "10.0.0.5", 8081, "Space")));
    }

    @Test
    @DisplayName("Re-registering the same address refreshes the entry in place")
    void reRegisterRefreshes() {
        String id = registry.register(registration(null, "10.0.0.5", 8081, "Space"));
        clock.advanceSeconds(20);

        String again = registry.register(new ServerRegistration(null, "10.0.0.5", 8081, "Space v2", 10, 3, null));

        assertEquals(id, again);
        MatchmakerEntry entry = registry.get(id);
        assertEquals("Space v2", entry.name());
        assertEquals(3, entry.currentPlayers());
        assertEquals(clock.instant(), entry.lastHeartbeat());
        assertEquals(clock.instant().minusSeconds(20), entry.registeredAt());
        assertEquals(1, registry.list(false).size());
        assertEquals(1.0, meterRegistry.find("playfactory.matchmaker.registrations")
                .tag("kind", "refresh").counter().count());
    }

    @Test
    @DisplayName("The room list reports uptime since first registration and liveness")
    void listingReportsUptime() {
        String id = registry.register(registration(null, "192.168.1.100", 8080, "X"));
        clock.advanceSeconds(25);
        registry.heartbeat(id, 4);
        clock.advanceSeconds(20);

        ServerListing listing = registry.listing(true).get(0);

        assertEquals(id, listing.entry().serverId());
        assertEquals(45, listing.uptimeSeconds());
        assertTrue(listing.active());

        clock.advanceSeconds(10);
        assertTrue(registry.listing(true).isEmpty());
        ServerListing lapsed = registry.listing(false).get(0);
        assertFalse(lapsed.active());
        assertEquals(55, lapsed.uptimeSeconds());
    }

    @Test
    @DisplayName("A lapsed entry is gone before the sweep and unknown after it")
    void lapsedThenEvicted() {
        String id = registry.register(registration(null, "192.168.1.100", 8080, "X"));
        clock.advanceSeconds(31);

        assertThrows(ServerGoneException.class, () -> registry.get(id));
        assertTrue(registry.list(true).isEmpty());
        assertEquals(1, registry.list(false).size());

        assertEquals(1, registry.sweepExpired());

        assertThrows(ServerNotFoundException.class, () -> registry.get(id));
        assertThrows(ServerNotFoundException.class, () -> registry.heartbeat(id, 1));
    }

    @Test
    @DisplayName("Heartbeats keep an entry alive past the timeout")
    void heartbeatKeepsAlive() {
        String id = registry.register(registration(null, "10.0.0.5", 8081, "Space"));
        for (int i = 0; i < 5; i++) {
            clock.advanceSeconds(20);
            registry.heartbeat(id, i);
        }

        assertEquals(0, registry.sweepExpired());
        assertEquals(4, registry.get(id).currentPlayers());
    }

    @Test
    @DisplayName("Heartbeat without a player count keeps the last one")
    void heartbeatWithoutPlayers() {
        String id = registry.register(new ServerRegistration(null, "10.0.0.5", 8081, "Space", 10, 7, null));

        assertEquals(7, registry.heartbeat(id, null).currentPlayers());
    }

    @Test
    @DisplayName("Entries are evicted at exactly the timeout")
    void evictionBoundary() {
        registry.register(registration(null, "10.0.0.5", 8081, "Space"));
        clock.advanceSeconds(29);
        assertEquals(0, registry.sweepExpired());

        clock.advanceSeconds(1);
        assertEquals(1, registry.sweepExpired());
        assertEquals(1.0, meterRegistry.find("playfactory.matchmaker.evictions").counter().count());
    }

    @Test
    @DisplayName("Eviction grace keeps lapsed entries visible as gone for longer")
    void evictionGrace() {
        properties.setEvictionGraceSeconds(30);
        registry = new LivenessRegistry(clock, properties, new FactoryMetrics(meterRegistry));
        String id = registry.register(registration(null, "10.0.0.5", 8081, "Space"));

        clock.advanceSeconds(45);
        assertEquals(0, registry.sweepExpired());
        assertThrows(ServerGoneException.class, () -> registry.get(id));

        clock.advanceSeconds(15);
        assertEquals(1, registry.sweepExpired());
    }

    @Test
    @DisplayName("Listing is ordered by registration time")
    void listOrder() {
        registry.register(registration(null, "10.0.0.2", 8081, "Second"));
        clock.advanceSeconds(1);
        registry.register(registration(null, "10.0.0.1", 8081, "Third"));

        assertEquals(java.util.List.of("Second", "Third"),
                registry.list(true).stream().map(MatchmakerEntry::name).toList());
    }

    @Test
    @DisplayName("unregister removes the entry and frees its address")
    void unregister() {
        String id = registry.register(registration(null, "10.0.0.5", 8081, "Space"));

        registry.unregister(id);

        assertThrows(ServerNotFoundException.class, () -> registry.get(id));
        assertThrows(ServerNotFoundException.class, () -> registry.unregister(id));
        assertEquals(id, registry.register(registration(null, "10.0.0.5", 8081, "Space")));
    }

    @Test
    @DisplayName("Invalid registrations are rejected")
    void validation() {
        assertThrows(InvalidInputException.class, () -> registry.register(registration(null, "", 8080, "X")));
        assertThrows(InvalidInputException.class, () -> registry.register(registration(null, "h", 0, "X")));
        assertThrows(InvalidInputException.class, () -> registry.register(registration(null, "h", 70000, "X")));
        assertThrows(InvalidInputException.class, () -> registry.register(registration(null, "h", 8080, "")));
        assertThrows(InvalidInputException.class,
                () -> registry.register(new ServerRegistration(null, "h", 8080, "X", 101, 0, null)));
        assertThrows(InvalidInputException.class,
                () -> registry.register(new ServerRegistration(null, "h", 8080, "X", 10, -1, null)));
        assertTrue(registry.list(false).isEmpty());
    }

    @Test
    @DisplayName("statistics counts active servers and their players")
    void statistics() {
        registry.register(new ServerRegistration(null, "10.0.0.1", 8081, "A", 10, 3, null));
        clock.advanceSeconds(25);
        registry.register(new ServerRegistration(null, "10.0.0.2", 8081, "B", 10, 4, null));
        clock.advanceSeconds(10);

        var stats = registry.statistics();

        assertEquals(1, stats.activeServers());
        assertEquals(2, stats.totalServers());
        assertEquals(4, stats.totalPlayers());
        assertEquals(30, stats.heartbeatTimeoutSeconds());
    }
}

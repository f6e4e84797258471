package com.playfactory.matchmaker;

import com.playfactory.core.error.InvalidInputException;
import com.playfactory.core.error.ServerGoneException;
import com.playfactory.core.error.ServerNotFoundException;
import com.playfactory.core.metrics.FactoryMetrics;
import com.playfactory.core.model.MatchmakerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Directory of live game servers that players browse to pick a room.
 *
 * <p>Game servers register themselves and then heartbeat. An entry whose last heartbeat is
 * older than the heartbeat timeout is inactive: it is hidden from active listings and answered
 * with {@link ServerGoneException} until the sweeper evicts it. Liveness is always derived
 * from the injected clock, never stored.
 */
@Component
public class LivenessRegistry {

    private static final Logger log = LoggerFactory.getLogger(LivenessRegistry.class);

    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_PLAYERS_LIMIT = 100;

    private final Map<String, MatchmakerEntry> entries = new HashMap<>();
    /** ip:port -> server id */
    private final Map<String, String> byAddress = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final Clock clock;
    private final Duration heartbeatTimeout;
    private final Duration evictionAfter;
    private final FactoryMetrics metrics;

    public LivenessRegistry(Clock clock, MatchmakerProperties properties, FactoryMetrics metrics) {
        this.clock = clock;
        this.heartbeatTimeout = Duration.ofSeconds(properties.getHeartbeatTimeoutSeconds());
        this.evictionAfter = heartbeatTimeout.plusSeconds(Math.max(0, properties.getEvictionGraceSeconds()));
        this.metrics = metrics;
    }

    /**
     * Registers a game server, or refreshes the entry already held for the same address.
     *
     * @return the id the server must use for heartbeats
     * @throws InvalidInputException if a field is out of range
     */
    public String register(ServerRegistration registration) {
        validate(registration);
        Instant now = clock.instant();
        String address = registration.address();
        boolean refreshed;
        String serverId;

        lock.lock();
        try {
            String existingId = byAddress.get(address);
            MatchmakerEntry existing = existingId != null ? entries.get(existingId) : null;
            if (existing != null) {
                serverId = existingId;
                entries.put(serverId, existing.refreshed(registration.name(), registration.maxPlayersOrDefault(),
                        registration.currentPlayersOrDefault(), registration.metadata(), now));
                refreshed = true;
            } else {
                serverId = chooseId(registration.serverId(), address);
                entries.put(serverId, new MatchmakerEntry(serverId, registration.ip(), registration.port(),
                        registration.name(), registration.maxPlayersOrDefault(),
                        registration.currentPlayersOrDefault(), registration.metadata(), now, now));
                byAddress.put(address, serverId);
                refreshed = false;
            }
        } finally {
            lock.unlock();
        }

        metrics.recordRegistration(refreshed);
        if (refreshed) {
            log.debug("Refreshed registration of {} at {}", serverId, address);
        } else {
            log.info("Registered game server {} '{}' at {}", serverId, registration.name(), address);
        }
        return serverId;
    }

    /**
     * @param currentPlayers new player count, or null to keep the last reported one
     * @throws ServerNotFoundException if the id is unknown or was evicted
     */
    public MatchmakerEntry heartbeat(String serverId, Integer currentPlayers) {
        if (currentPlayers != null && currentPlayers < 0) {
            throw new InvalidInputException("current_players must be >= 0");
        }
        lock.lock();
        try {
            MatchmakerEntry entry = entries.get(serverId);
            if (entry == null) {
                throw new ServerNotFoundException(serverId);
            }
            MatchmakerEntry next = entry.heartbeat(currentPlayers, clock.instant());
            entries.put(serverId, next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws ServerNotFoundException if the id is unknown
     * @throws ServerGoneException     if the entry has lapsed but is not yet evicted
     */
    public MatchmakerEntry get(String serverId) {
        MatchmakerEntry entry;
        lock.lock();
        try {
            entry = entries.get(serverId);
        } finally {
            lock.unlock();
        }
        if (entry == null) {
            throw new ServerNotFoundException(serverId);
        }
        if (!entry.isActive(clock.instant(), heartbeatTimeout)) {
            throw new ServerGoneException(serverId);
        }
        return entry;
    }

    /**
     * Entries ordered by registration time, oldest first.
     */
    public List<MatchmakerEntry> list(boolean activeOnly) {
        Instant now = clock.instant();
        List<MatchmakerEntry> snapshot = snapshot();
        return snapshot.stream()
                .filter(e -> !activeOnly || e.isActive(now, heartbeatTimeout))
                .sorted(Comparator.comparing(MatchmakerEntry::registeredAt).thenComparing(MatchmakerEntry::serverId))
                .toList();
    }

    /**
     * The room list: {@link #list(boolean)} with liveness and uptime evaluated at one instant.
     */
    public List<ServerListing> listing(boolean activeOnly) {
        Instant now = clock.instant();
        return list(activeOnly).stream()
                .map(e -> ServerListing.of(e, now, heartbeatTimeout))
                .toList();
    }

    public void unregister(String serverId) {
        MatchmakerEntry removed;
        lock.lock();
        try {
            removed = entries.remove(serverId);
            if (removed != null) {
                byAddress.remove(removed.ip() + ":" + removed.port(), serverId);
            }
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            throw new ServerNotFoundException(serverId);
        }
        log.info("Unregistered game server {}", serverId);
    }

    /**
     * Evicts entries whose last heartbeat is at least the heartbeat timeout plus the eviction
     * grace in the past.
     *
     * @return how many entries were removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        var evicted = new ArrayList<String>();
        lock.lock();
        try {
            Iterator<MatchmakerEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                MatchmakerEntry entry = it.next();
                if (Duration.between(entry.lastHeartbeat(), now).compareTo(evictionAfter) >= 0) {
                    it.remove();
                    byAddress.remove(entry.ip() + ":" + entry.port(), entry.serverId());
                    evicted.add(entry.serverId());
                }
            }
        } finally {
            lock.unlock();
        }
        if (!evicted.isEmpty()) {
            metrics.recordEvictions(evicted.size());
            log.info("Evicted {} game server(s) without heartbeat: {}", evicted.size(), evicted);
        }
        return evicted.size();
    }

    public MatchmakerStatistics statistics() {
        Instant now = clock.instant();
        List<MatchmakerEntry> snapshot = snapshot();
        int active = 0;
        int players = 0;
        for (MatchmakerEntry entry : snapshot) {
            if (entry.isActive(now, heartbeatTimeout)) {
                active++;
                players += entry.currentPlayers();
            }
        }
        return new MatchmakerStatistics(active, snapshot.size(), players, heartbeatTimeout.toSeconds());
    }

    private List<MatchmakerEntry> snapshot() {
        lock.lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private String chooseId(String requested, String address) {
        if (requested != null && !requested.isBlank() && !entries.containsKey(requested)) {
            return requested;
        }
        if (!entries.containsKey(address)) {
            return address;
        }
        return UUID.randomUUID().toString();
    }

    private static void validate(ServerRegistration registration) {
        if (registration.ip() == null || registration.ip().isBlank()) {
            throw new InvalidInputException("ip is required");
        }
        if (registration.port() == null || registration.port() < 1 || registration.port() > 65535) {
            throw new InvalidInputException("port must be between 1 and 65535");
        }
        if (registration.name() == null || registration.name().isEmpty()
                || registration.name().length() > MAX_NAME_LENGTH) {
            throw new InvalidInputException("name must be 1-" + MAX_NAME_LENGTH + " characters");
        }
        int maxPlayers = registration.maxPlayersOrDefault();
        if (maxPlayers < 1 || maxPlayers > MAX_PLAYERS_LIMIT) {
            throw new InvalidInputException("max_players must be between 1 and " + MAX_PLAYERS_LIMIT);
        }
        if (registration.currentPlayersOrDefault() < 0) {
            throw new InvalidInputException("current_players must be >= 0");
        }
    }
}

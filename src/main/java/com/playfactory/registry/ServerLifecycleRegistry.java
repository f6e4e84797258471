package com.playfactory.registry;

import com.playfactory.core.error.ServerNotFoundException;
import com.playfactory.core.model.GameServerInstance;
import com.playfactory.core.model.ServerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Authoritative in-memory table of provisioned game servers, keyed by server id and kept in
 * creation order.
 *
 * <p>All access goes through a single read/write lock. Callers must not perform container
 * runtime I/O inside {@link #update}; the operator is expected to be a pure transformation.
 * {@link #list()} returns a copy, so iteration never observes a concurrent mutation.
 */
@Component
public class ServerLifecycleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerLifecycleRegistry.class);

    private final Map<String, GameServerInstance> servers = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public GameServerInstance get(String serverId) {
        return find(serverId).orElseThrow(() -> new ServerNotFoundException(serverId));
    }

    public Optional<GameServerInstance> find(String serverId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(servers.get(serverId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<GameServerInstance> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(servers.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void upsert(GameServerInstance instance) {
        if (instance.status() == ServerStatus.REMOVED) {
            throw new IllegalArgumentException("Removed servers are deleted, not stored: " + instance.serverId());
        }
        lock.writeLock().lock();
        try {
            servers.put(instance.serverId(), instance);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Recorded server {} ({})", instance.serverId(), instance.status());
    }

    /**
     * Atomically replaces the stored instance with {@code change.apply(current)}.
     *
     * @return the stored result
     * @throws ServerNotFoundException if the id is unknown
     */
    public GameServerInstance update(String serverId, UnaryOperator<GameServerInstance> change) {
        lock.writeLock().lock();
        try {
            GameServerInstance current = servers.get(serverId);
            if (current == null) {
                throw new ServerNotFoundException(serverId);
            }
            GameServerInstance next = change.apply(current);
            servers.put(serverId, next);
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public GameServerInstance delete(String serverId) {
        GameServerInstance removed;
        lock.writeLock().lock();
        try {
            removed = servers.remove(serverId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            throw new ServerNotFoundException(serverId);
        }
        log.debug("Deleted server {}", serverId);
        return removed;
    }

    /**
     * Ports held by servers that are provisioning or running.
     */
    public Set<Integer> activePorts() {
        lock.readLock().lock();
        try {
            return servers.values().stream()
                    .filter(s -> s.status().holdsPort() && s.port() != null)
                    .map(GameServerInstance::port)
                    .collect(Collectors.toUnmodifiableSet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<ServerStatus, Integer> countByStatus() {
        var counts = new EnumMap<ServerStatus, Integer>(ServerStatus.class);
        for (var server : list()) {
            counts.merge(server.status(), 1, Integer::sum);
        }
        return counts;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return servers.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}

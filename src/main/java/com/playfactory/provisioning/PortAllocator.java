package com.playfactory.provisioning;

import com.playfactory.core.error.NoPortAvailableException;
import com.playfactory.registry.ServerLifecycleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Leases host ports for game server containers from a bounded, inclusive range.
 *
 * <p>A port handed out by {@link #allocate()} stays leased until {@link #release(int)}, which
 * covers the window between allocation and the registry insert as well as the lifetime of
 * the server. The scan, the registry cross-check and the lease are one critical section.
 */
public class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    private final ServerLifecycleRegistry registry;
    private final PortProbe probe;
    private final int rangeStart;
    private final int rangeEnd;
    private final Set<Integer> leased = new HashSet<>();

    public PortAllocator(ServerLifecycleRegistry registry, PortProbe probe, int rangeStart, int rangeEnd) {
        if (rangeStart < 1 || rangeEnd > 65535 || rangeStart > rangeEnd) {
            throw new IllegalArgumentException("Invalid port range " + rangeStart + "-" + rangeEnd);
        }
        this.registry = registry;
        this.probe = probe;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    /**
     * Leases the lowest port in range that is not leased, not held by an active server and
     * bindable on the host.
     *
     * @throws NoPortAvailableException when the whole range is taken
     */
    public synchronized int allocate() {
        Set<Integer> held = registry.activePorts();
        for (int port = rangeStart; port <= rangeEnd; port++) {
            if (leased.contains(port) || held.contains(port)) continue;
            if (probe.isFree(port)) {
                leased.add(port);
                log.debug("Leased port {}", port);
                return port;
            }
        }
        log.warn("Port range {}-{} exhausted ({} leased)", rangeStart, rangeEnd, leased.size());
        throw new NoPortAvailableException(rangeStart, rangeEnd);
    }

    public synchronized void release(int port) {
        if (leased.remove(port)) {
            log.debug("Released port {}", port);
        }
    }

    public synchronized boolean isLeased(int port) {
        return leased.contains(port);
    }

    public synchronized int leasedCount() {
        return leased.size();
    }

    public synchronized Set<Integer> leasedPorts() {
        return Set.copyOf(leased);
    }

    public int rangeStart() {
        return rangeStart;
    }

    public int rangeEnd() {
        return rangeEnd;
    }
}

package com.playfactory.matchmaker;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Evicts matchmaker entries whose heartbeat lapsed, on a fixed delay.
 */
@Service
public class EvictionSweeper {

    private static final Logger log = LoggerFactory.getLogger(EvictionSweeper.class);

    private final LivenessRegistry registry;
    private final MatchmakerProperties properties;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "matchmaker-sweeper");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running;

    public EvictionSweeper(LivenessRegistry registry, MatchmakerProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @PostConstruct
    void start() {
        if (!properties.isSweeperEnabled()) {
            log.info("Matchmaker sweeper disabled");
            return;
        }
        long interval = Math.max(1, properties.getSweepIntervalSeconds());
        scheduler.scheduleWithFixedDelay(this::sweepOnce, interval, interval, TimeUnit.SECONDS);
        running = true;
        log.info("Matchmaker sweeper started (interval={}s, timeout={}s)",
                interval, properties.getHeartbeatTimeoutSeconds());
    }

    @PreDestroy
    void shutdown() {
        running = false;
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Matchmaker sweeper did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Matchmaker sweeper stopped");
    }

    /**
     * Runs one sweep. Failures are logged so the next tick still runs.
     *
     * @return entries evicted, or -1 if the sweep failed
     */
    public int sweepOnce() {
        try {
            return registry.sweepExpired();
        } catch (RuntimeException e) {
            log.error("Matchmaker sweep failed: {}", e.getMessage(), e);
            return -1;
        }
    }

    public boolean isRunning() {
        return running && !scheduler.isShutdown();
    }
}

package com.playfactory.provisioning;

import com.playfactory.core.error.ServerNotFoundException;
import com.playfactory.core.model.GameServerInstance;
import com.playfactory.core.model.ServerStatus;
import com.playfactory.registry.ServerLifecycleRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks the containers of running servers, so a crashed game server shows up
 * as ERROR and its resource snapshot stays fresh for admission decisions. Servers that have
 * been idle past the configured timeout are stopped at the end of each pass.
 */
@Service
@ConditionalOnProperty(name = "playfactory.factory.monitor-enabled", havingValue = "true", matchIfMissing = true)
public class ContainerMonitor {

    private static final Logger log = LoggerFactory.getLogger(ContainerMonitor.class);

    private final GameServerManager manager;
    private final ServerLifecycleRegistry registry;
    private final long intervalSeconds;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "container-monitor");
        t.setDaemon(true);
        return t;
    });

    public ContainerMonitor(GameServerManager manager, ServerLifecycleRegistry registry,
                            FactoryProperties properties) {
        this.manager = manager;
        this.registry = registry;
        this.intervalSeconds = Math.max(1, properties.getMonitorIntervalSeconds());
    }

    @PostConstruct
    void start() {
        scheduler.scheduleWithFixedDelay(this::checkOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Container monitor started (interval={}s)", intervalSeconds);
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
        log.info("Container monitor stopped");
    }

    /**
     * Refreshes status and stats of every running server, then stops idle ones. Returns the
     * number checked.
     */
    public int checkOnce() {
        int checked = 0;
        for (GameServerInstance server : registry.list()) {
            if (server.status() != ServerStatus.RUNNING) continue;
            try {
                GameServerInstance current = manager.refreshStatus(server.serverId());
                if (current.status() == ServerStatus.RUNNING) {
                    manager.refreshStats(server.serverId());
                }
                checked++;
            } catch (ServerNotFoundException e) {
                log.debug("Server {} removed during monitor pass", server.serverId());
            } catch (RuntimeException e) {
                log.error("Monitor check failed for {}: {}", server.serverId(), e.getMessage(), e);
            }
        }
        try {
            List<String> reclaimed = manager.reclaimIdle();
            if (!reclaimed.isEmpty()) {
                log.info("Stopped {} idle server(s): {}", reclaimed.size(), reclaimed);
            }
        } catch (RuntimeException e) {
            log.error("Idle reclamation failed: {}", e.getMessage(), e);
        }
        return checked;
    }
}

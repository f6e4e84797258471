package com.playfactory.core.health;

import com.playfactory.matchmaker.EvictionSweeper;
import com.playfactory.provisioning.AdmissionController;
import com.playfactory.provisioning.AdmissionDecision;
import com.playfactory.runtime.ContainerRuntime;
import com.playfactory.runtime.ContainerRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ContainerRuntime containerRuntime;
    private final EvictionSweeper evictionSweeper;
    private final AdmissionController admissionController;

    public HealthCheckService(
            @Autowired(required = false) ContainerRuntime containerRuntime,
            @Autowired(required = false) EvictionSweeper evictionSweeper,
            @Autowired(required = false) AdmissionController admissionController) {
        this.containerRuntime = containerRuntime;
        this.evictionSweeper = evictionSweeper;
        this.admissionController = admissionController;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDocker());
        results.add(checkMatchmaker());
        results.add(checkCapacity());
        return results;
    }

    private HealthStatus checkDocker() {
        if (containerRuntime == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No ContainerRuntime configured", Map.of());
        }
        try {
            containerRuntime.ping();
            return new HealthStatus("docker", HealthStatus.Status.UP,
                    "Container runtime reachable (" + containerRuntime.getClass().getSimpleName() + ")", Map.of());
        } catch (ContainerRuntimeException e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkMatchmaker() {
        if (evictionSweeper == null) {
            return new HealthStatus("matchmaker", HealthStatus.Status.DOWN,
                    "Eviction sweeper not available", Map.of());
        }
        if (evictionSweeper.isRunning()) {
            return new HealthStatus("matchmaker", HealthStatus.Status.UP,
                    "Eviction sweeper running", Map.of());
        }
        return new HealthStatus("matchmaker", HealthStatus.Status.DEGRADED,
                "Eviction sweeper not running; lapsed servers are hidden but not evicted", Map.of());
    }

    private HealthStatus checkCapacity() {
        if (admissionController == null) {
            return new HealthStatus("capacity", HealthStatus.Status.DOWN,
                    "No AdmissionController configured", Map.of());
        }
        AdmissionDecision decision = admissionController.canAdmit();
        if (decision.allowed()) {
            return new HealthStatus("capacity", HealthStatus.Status.UP, decision.reason(), Map.of());
        }
        return new HealthStatus("capacity", HealthStatus.Status.DEGRADED, decision.reason(),
                Map.of("accepting", "false"));
    }
}

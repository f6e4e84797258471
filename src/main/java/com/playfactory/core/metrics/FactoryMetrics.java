package com.playfactory.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for provisioning and matchmaking.
 */
@Service
public class FactoryMetrics {

    private final MeterRegistry registry;

    public FactoryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "success" or the lower-cased error code of the failure
     */
    public void recordProvisioning(String outcome, long ms) {
        Counter.builder("playfactory.provisioning.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("playfactory.provisioning.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStop() {
        Counter.builder("playfactory.servers.stopped")
                .register(registry)
                .increment();
    }

    public void recordRemoval() {
        Counter.builder("playfactory.servers.removed")
                .register(registry)
                .increment();
    }

    public void recordContainerFailure() {
        Counter.builder("playfactory.servers.failed")
                .description("Running servers whose container exited unexpectedly")
                .register(registry)
                .increment();
    }

    // --- Matchmaker ---

    /**
     * @param refresh true when an existing entry for the same address was refreshed
     */
    public void recordRegistration(boolean refresh) {
        Counter.builder("playfactory.matchmaker.registrations")
                .tag("kind", refresh ? "refresh" : "new")
                .register(registry)
                .increment();
    }

    public void recordEvictions(int count) {
        Counter.builder("playfactory.matchmaker.evictions")
                .description("Entries removed after their heartbeat lapsed")
                .register(registry)
                .increment(count);
    }
}

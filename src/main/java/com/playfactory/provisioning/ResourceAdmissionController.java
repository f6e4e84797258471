package com.playfactory.provisioning;

import com.playfactory.core.model.GameServerInstance;
import com.playfactory.registry.ServerLifecycleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;

/**
 * Admits new servers while the container count and the aggregate CPU/memory reservation stay
 * under the configured ceilings.
 *
 * <p>Active servers are those provisioning or running, plus attempts that hold a port lease
 * but are not yet in the registry. Each counts for one container's configured memory and
 * CPU limit. The observed CPU ceiling uses the cached usage snapshots, not live stats.
 */
public class ResourceAdmissionController implements AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(ResourceAdmissionController.class);

    private final ServerLifecycleRegistry registry;
    private final PortAllocator portAllocator;
    private final FactoryProperties properties;

    public ResourceAdmissionController(ServerLifecycleRegistry registry, PortAllocator portAllocator,
                                       FactoryProperties properties) {
        this.registry = registry;
        this.portAllocator = portAllocator;
        this.properties = properties;
    }

    @Override
    public AdmissionDecision canAdmit() {
        List<GameServerInstance> servers = registry.list();
        int active = activeCount(servers);

        if (active >= properties.getMaxContainers()) {
            return deny("Maximum container count reached (" + properties.getMaxContainers() + ")");
        }

        long reservedMemory = (long) (active + 1) * properties.getContainerMemoryLimitMb();
        if (reservedMemory > properties.getMaxReservedMemoryMb()) {
            return deny("Memory reservation would exceed " + properties.getMaxReservedMemoryMb() + " MB");
        }

        double reservedCpus = (active + 1) * properties.getContainerCpuLimit();
        if (reservedCpus > properties.getMaxReservedCpus()) {
            return deny("CPU reservation would exceed " + properties.getMaxReservedCpus() + " cores");
        }

        double observedCpu = servers.stream()
                .filter(s -> s.status().holdsPort())
                .mapToDouble(s -> s.resourceUsage().cpuPercent())
                .sum();
        if (observedCpu >= properties.getMaxObservedCpuPercent()) {
            return deny(String.format("Observed CPU usage %.1f%% at or above limit %.1f%%",
                    observedCpu, properties.getMaxObservedCpuPercent()));
        }

        return AdmissionDecision.allow();
    }

    /**
     * Provisioning or running servers plus leases held by attempts not yet recorded.
     */
    int activeCount(List<GameServerInstance> servers) {
        var recordedPorts = new HashSet<Integer>();
        int active = 0;
        for (var server : servers) {
            if (server.port() != null) {
                recordedPorts.add(server.port());
            }
            if (server.status().holdsPort()) {
                active++;
            }
        }
        int inFlight = (int) portAllocator.leasedPorts().stream()
                .filter(p -> !recordedPorts.contains(p))
                .count();
        return active + inFlight;
    }

    private AdmissionDecision deny(String reason) {
        log.warn("Admission denied: {}", reason);
        return AdmissionDecision.deny(reason);
    }
}

package com.playfactory.provisioning;

import com.playfactory.registry.ServerLifecycleRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProvisioningConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PortAllocator portAllocator(ServerLifecycleRegistry registry, FactoryProperties properties) {
        return new PortAllocator(registry, PortProbe.socketBind(),
                properties.getPortRangeStart(), properties.getPortRangeEnd());
    }

    @Bean
    public AdmissionController admissionController(ServerLifecycleRegistry registry, PortAllocator portAllocator,
                                                   FactoryProperties properties) {
        return new ResourceAdmissionController(registry, portAllocator, properties);
    }

    @Bean
    public UserCodeInspector userCodeInspector(FactoryProperties properties) {
        return new UserCodeInspector(properties.getMaxCodeSizeBytes(), properties.isSecurityScanEnabled());
    }

    /**
     * Node.js is the only supported game runtime; the scaffold is swappable for tests.
     */
    @Bean
    public ServerScaffold serverScaffold() {
        return new NodeServerScaffold();
    }
}

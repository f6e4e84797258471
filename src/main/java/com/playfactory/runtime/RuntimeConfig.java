package com.playfactory.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuntimeConfig {

    private static final Logger log = LoggerFactory.getLogger(RuntimeConfig.class);

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "playfactory.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient(RuntimeProperties properties) {
        String dockerHost = properties.getDockerHost();
        if (dockerHost == null || dockerHost.isBlank()) {
            dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        }
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "playfactory.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public ContainerRuntime dockerContainerRuntime(DockerClient dockerClient, RuntimeProperties properties) {
        var runtime = new DockerContainerRuntime(dockerClient, properties);
        try {
            runtime.ensureNetwork();
        } catch (ContainerRuntimeException e) {
            // The daemon may come up later; launches fail with LAUNCH_FAILED until it does
            log.warn("Docker not ready at startup: {}", e.getMessage());
        }
        return runtime;
    }
}

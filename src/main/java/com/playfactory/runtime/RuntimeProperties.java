package com.playfactory.runtime;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "playfactory.runtime")
public class RuntimeProperties {

    private String provider = "docker";
    private String dockerHost = "";
    private String network = "game-network";
    private String imagePrefix = "game-server";
    private int containerPort = 8080;
    private int buildTimeoutSeconds = 300;
    private int stopTimeoutSeconds = 10;
    private int logTimeoutSeconds = 30;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getDockerHost() { return dockerHost; }
    public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    public String getNetwork() { return network; }
    public void setNetwork(String network) { this.network = network; }
    public String getImagePrefix() { return imagePrefix; }
    public void setImagePrefix(String imagePrefix) { this.imagePrefix = imagePrefix; }
    public int getContainerPort() { return containerPort; }
    public void setContainerPort(int containerPort) { this.containerPort = containerPort; }
    public int getBuildTimeoutSeconds() { return buildTimeoutSeconds; }
    public void setBuildTimeoutSeconds(int buildTimeoutSeconds) { this.buildTimeoutSeconds = buildTimeoutSeconds; }
    public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
    public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
    public int getLogTimeoutSeconds() { return logTimeoutSeconds; }
    public void setLogTimeoutSeconds(int logTimeoutSeconds) { this.logTimeoutSeconds = logTimeoutSeconds; }
}

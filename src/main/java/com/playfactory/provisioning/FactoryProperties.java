package com.playfactory.provisioning;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "playfactory.factory")
public class FactoryProperties {

    private int portRangeStart = 8081;
    private int portRangeEnd = 9080;
    private int maxCodeSizeBytes = 1024 * 1024;
    private boolean securityScanEnabled = true;

    // -- Admission ceilings --
    private int maxContainers = 50;
    private int containerMemoryLimitMb = 512;
    private double containerCpuLimit = 1.0;
    private long maxReservedMemoryMb = 16384;
    private double maxReservedCpus = 32;
    private double maxObservedCpuPercent = 400.0;

    private int logRetention = 200;
    private boolean monitorEnabled = true;
    private int monitorIntervalSeconds = 60;
    /** Running servers with no activity for this long are stopped by the monitor; 0 disables. */
    private int idleTimeoutSeconds = 1800;
    private String matchmakerUrl = "http://localhost:8000";

    public int getPortRangeStart() { return portRangeStart; }
    public void setPortRangeStart(int portRangeStart) { this.portRangeStart = portRangeStart; }
    public int getPortRangeEnd() { return portRangeEnd; }
    public void setPortRangeEnd(int portRangeEnd) { this.portRangeEnd = portRangeEnd; }
    public int getMaxCodeSizeBytes() { return maxCodeSizeBytes; }
    public void setMaxCodeSizeBytes(int maxCodeSizeBytes) { this.maxCodeSizeBytes = maxCodeSizeBytes; }
    public boolean isSecurityScanEnabled() { return securityScanEnabled; }
    public void setSecurityScanEnabled(boolean securityScanEnabled) { this.securityScanEnabled = securityScanEnabled; }
    public int getMaxContainers() { return maxContainers; }
    public void setMaxContainers(int maxContainers) { this.maxContainers = maxContainers; }
    public int getContainerMemoryLimitMb() { return containerMemoryLimitMb; }
    public void setContainerMemoryLimitMb(int containerMemoryLimitMb) { this.containerMemoryLimitMb = containerMemoryLimitMb; }
    public double getContainerCpuLimit() { return containerCpuLimit; }
    public void setContainerCpuLimit(double containerCpuLimit) { this.containerCpuLimit = containerCpuLimit; }
    public long getMaxReservedMemoryMb() { return maxReservedMemoryMb; }
    public void setMaxReservedMemoryMb(long maxReservedMemoryMb) { this.maxReservedMemoryMb = maxReservedMemoryMb; }
    public double getMaxReservedCpus() { return maxReservedCpus; }
    public void setMaxReservedCpus(double maxReservedCpus) { this.maxReservedCpus = maxReservedCpus; }
    public double getMaxObservedCpuPercent() { return maxObservedCpuPercent; }
    public void setMaxObservedCpuPercent(double maxObservedCpuPercent) { this.maxObservedCpuPercent = maxObservedCpuPercent; }
    public int getLogRetention() { return logRetention; }
    public void setLogRetention(int logRetention) { this.logRetention = logRetention; }
    public boolean isMonitorEnabled() { return monitorEnabled; }
    public void setMonitorEnabled(boolean monitorEnabled) { this.monitorEnabled = monitorEnabled; }
    public int getMonitorIntervalSeconds() { return monitorIntervalSeconds; }
    public void setMonitorIntervalSeconds(int monitorIntervalSeconds) { this.monitorIntervalSeconds = monitorIntervalSeconds; }
    public int getIdleTimeoutSeconds() { return idleTimeoutSeconds; }
    public void setIdleTimeoutSeconds(int idleTimeoutSeconds) { this.idleTimeoutSeconds = idleTimeoutSeconds; }
    public String getMatchmakerUrl() { return matchmakerUrl; }
    public void setMatchmakerUrl(String matchmakerUrl) { this.matchmakerUrl = matchmakerUrl; }
}

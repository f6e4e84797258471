package com.playfactory.matchmaker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "playfactory.matchmaker")
public class MatchmakerProperties {

    private int heartbeatTimeoutSeconds = 30;
    private int sweepIntervalSeconds = 10;
    /** Extra time a lapsed entry is kept (reported as gone) before the sweeper evicts it. */
    private int evictionGraceSeconds = 0;
    private boolean sweeperEnabled = true;

    public int getHeartbeatTimeoutSeconds() { return heartbeatTimeoutSeconds; }
    public void setHeartbeatTimeoutSeconds(int heartbeatTimeoutSeconds) { this.heartbeatTimeoutSeconds = heartbeatTimeoutSeconds; }
    public int getSweepIntervalSeconds() { return sweepIntervalSeconds; }
    public void setSweepIntervalSeconds(int sweepIntervalSeconds) { this.sweepIntervalSeconds = sweepIntervalSeconds; }
    public int getEvictionGraceSeconds() { return evictionGraceSeconds; }
    public void setEvictionGraceSeconds(int evictionGraceSeconds) { this.evictionGraceSeconds = evictionGraceSeconds; }
    public boolean isSweeperEnabled() { return sweeperEnabled; }
    public void setSweeperEnabled(boolean sweeperEnabled) { this.sweeperEnabled = sweeperEnabled; }
}

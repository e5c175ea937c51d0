package de.bsommerfeld.launchpad.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitoringConfig {

    @JsonProperty("process-poll-interval-millis")
    private long processPollIntervalMillis = 2000;

    @JsonProperty("refresh-interval-seconds")
    private long refreshIntervalSeconds = 5;

    @JsonProperty("window-watch-interval-seconds")
    private long windowWatchIntervalSeconds = 5;

    @JsonProperty("graceful-close-timeout-seconds")
    private long gracefulCloseTimeoutSeconds = 5;

    @JsonProperty("kill-timeout-seconds")
    private long killTimeoutSeconds = 3;

    @JsonProperty("retention-minutes")
    private long retentionMinutes = 10;

    public long getProcessPollIntervalMillis() {
        return processPollIntervalMillis;
    }

    public void setProcessPollIntervalMillis(long processPollIntervalMillis) {
        this.processPollIntervalMillis = processPollIntervalMillis;
    }

    public long getRefreshIntervalSeconds() {
        return refreshIntervalSeconds;
    }

    public void setRefreshIntervalSeconds(long refreshIntervalSeconds) {
        this.refreshIntervalSeconds = refreshIntervalSeconds;
    }

    public long getWindowWatchIntervalSeconds() {
        return windowWatchIntervalSeconds;
    }

    public void setWindowWatchIntervalSeconds(long windowWatchIntervalSeconds) {
        this.windowWatchIntervalSeconds = windowWatchIntervalSeconds;
    }

    public long getGracefulCloseTimeoutSeconds() {
        return gracefulCloseTimeoutSeconds;
    }

    public void setGracefulCloseTimeoutSeconds(long gracefulCloseTimeoutSeconds) {
        this.gracefulCloseTimeoutSeconds = gracefulCloseTimeoutSeconds;
    }

    public long getKillTimeoutSeconds() {
        return killTimeoutSeconds;
    }

    public void setKillTimeoutSeconds(long killTimeoutSeconds) {
        this.killTimeoutSeconds = killTimeoutSeconds;
    }

    public long getRetentionMinutes() {
        return retentionMinutes;
    }

    public void setRetentionMinutes(long retentionMinutes) {
        this.retentionMinutes = retentionMinutes;
    }

    // -- Derived durations --

    public Duration processPollInterval() {
        return Duration.ofMillis(processPollIntervalMillis);
    }

    public Duration refreshInterval() {
        return Duration.ofSeconds(refreshIntervalSeconds);
    }

    public Duration windowWatchInterval() {
        return Duration.ofSeconds(windowWatchIntervalSeconds);
    }

    public Duration gracefulCloseTimeout() {
        return Duration.ofSeconds(gracefulCloseTimeoutSeconds);
    }

    public Duration killTimeout() {
        return Duration.ofSeconds(killTimeoutSeconds);
    }

    public Duration retention() {
        return Duration.ofMinutes(retentionMinutes);
    }
}

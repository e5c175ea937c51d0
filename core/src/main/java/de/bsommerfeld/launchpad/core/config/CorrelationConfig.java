package de.bsommerfeld.launchpad.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for matching launched applications to their OS windows.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CorrelationConfig {

    /** Window class shared by every Android app hosted in the subsystem. */
    @JsonProperty("frame-window-class")
    private String frameWindowClass = "ApplicationFrameWindow";

    @JsonProperty("folder-window-classes")
    private List<String> folderWindowClasses = new ArrayList<>(List.of("CabinetWClass", "ExplorerWClass"));

    @JsonProperty("launch-tolerance-seconds")
    private long launchToleranceSeconds = 30;

    @JsonProperty("cache-ttl-seconds")
    private long cacheTtlSeconds = 30;

    @JsonProperty("attempts")
    private int attempts = 5;

    @JsonProperty("attempt-delay-millis")
    private long attemptDelayMillis = 1000;

    /** How long to wait for the main window of a freshly started process. */
    @JsonProperty("process-window-timeout-millis")
    private long processWindowTimeoutMillis = 3000;

    public String getFrameWindowClass() {
        return frameWindowClass;
    }

    public void setFrameWindowClass(String frameWindowClass) {
        this.frameWindowClass = frameWindowClass;
    }

    public List<String> getFolderWindowClasses() {
        return folderWindowClasses;
    }

    public void setFolderWindowClasses(List<String> folderWindowClasses) {
        this.folderWindowClasses = folderWindowClasses;
    }

    public long getLaunchToleranceSeconds() {
        return launchToleranceSeconds;
    }

    public void setLaunchToleranceSeconds(long launchToleranceSeconds) {
        this.launchToleranceSeconds = launchToleranceSeconds;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public long getAttemptDelayMillis() {
        return attemptDelayMillis;
    }

    public void setAttemptDelayMillis(long attemptDelayMillis) {
        this.attemptDelayMillis = attemptDelayMillis;
    }

    public long getProcessWindowTimeoutMillis() {
        return processWindowTimeoutMillis;
    }

    public void setProcessWindowTimeoutMillis(long processWindowTimeoutMillis) {
        this.processWindowTimeoutMillis = processWindowTimeoutMillis;
    }

    public Duration launchTolerance() {
        return Duration.ofSeconds(launchToleranceSeconds);
    }

    public Duration cacheTtl() {
        return Duration.ofSeconds(cacheTtlSeconds);
    }

    public Duration attemptDelay() {
        return Duration.ofMillis(attemptDelayMillis);
    }

    public Duration processWindowTimeout() {
        return Duration.ofMillis(processWindowTimeoutMillis);
    }
}

package de.bsommerfeld.launchpad.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AndroidConfig {

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("adb-path")
    private String adbPath = "adb";

    /** adb endpoint of the compatibility subsystem. */
    @JsonProperty("device")
    private String device = "127.0.0.1:58526";

    @JsonProperty("command-timeout-seconds")
    private long commandTimeoutSeconds = 15;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAdbPath() {
        return adbPath;
    }

    public void setAdbPath(String adbPath) {
        this.adbPath = adbPath;
    }

    public String getDevice() {
        return device;
    }

    public void setDevice(String device) {
        this.device = device;
    }

    public long getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public void setCommandTimeoutSeconds(long commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }

    public Duration commandTimeout() {
        return Duration.ofSeconds(commandTimeoutSeconds);
    }
}

package de.bsommerfeld.launchpad.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Every section is created with defaults, so a
 * file that only overrides a single key still yields a complete
 * configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LaunchpadConfig {

    @JsonProperty("principal")
    private String principal = "";

    @JsonProperty("monitoring")
    private MonitoringConfig monitoring = new MonitoringConfig();

    @JsonProperty("correlation")
    private CorrelationConfig correlation = new CorrelationConfig();

    @JsonProperty("android")
    private AndroidConfig android = new AndroidConfig();

    @JsonProperty("browser")
    private BrowserConfig browser = new BrowserConfig();

    /**
     * Principal override. Empty means the operating system user.
     */
    public String getPrincipal() {
        return principal;
    }

    public void setPrincipal(String principal) {
        this.principal = principal;
    }

    public MonitoringConfig getMonitoring() {
        return monitoring;
    }

    public CorrelationConfig getCorrelation() {
        return correlation;
    }

    public AndroidConfig getAndroid() {
        return android;
    }

    public BrowserConfig getBrowser() {
        return browser;
    }
}

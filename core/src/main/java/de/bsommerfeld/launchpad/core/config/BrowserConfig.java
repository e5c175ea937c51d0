package de.bsommerfeld.launchpad.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class BrowserConfig {

    /** Chromium-family executable for app-mode windows. Empty means auto-detect. */
    @JsonProperty("executable")
    private String executable = "";

    @JsonProperty("app-mode-flags")
    private List<String> appModeFlags = new ArrayList<>(
            List.of("--no-first-run", "--no-default-browser-check", "--start-maximized"));

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }

    public List<String> getAppModeFlags() {
        return appModeFlags;
    }

    public void setAppModeFlags(List<String> appModeFlags) {
        this.appModeFlags = appModeFlags;
    }
}

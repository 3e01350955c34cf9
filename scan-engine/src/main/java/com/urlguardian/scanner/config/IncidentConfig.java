package com.urlguardian.scanner.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Incident and feedback persistence configuration.
 *
 * @author URL Guardian Team
 */
@Validated
@ConfigurationProperties(prefix = "guardian.incidents")
public class IncidentConfig {

    /** {@code file} or {@code memory}. */
    @NotBlank
    private String store = "file";

    private String directory = "data";

    /** Number of most recent feedback records used for rolling accuracy. */
    @Min(1)
    private int rollingWindow = 100;

    @Min(1)
    private int maxRecent = 100;

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public int getRollingWindow() {
        return rollingWindow;
    }

    public void setRollingWindow(int rollingWindow) {
        this.rollingWindow = rollingWindow;
    }

    public int getMaxRecent() {
        return maxRecent;
    }

    public void setMaxRecent(int maxRecent) {
        this.maxRecent = maxRecent;
    }
}

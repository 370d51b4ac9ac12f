package com.reasons.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Reasons.
 */
@ConfigurationProperties(prefix = "reasons")
public class ReasonsProperties {

    /**
     * Whether the rule engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Reasons configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:reasons.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}

package com.mailmind.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for MailMind.
 */
@ConfigurationProperties(prefix = "mailmind")
public class MailMindProperties {

    /**
     * Whether MailMind is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the MailMind configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:mailmind.yaml";

    /**
     * Where sender profiles and the classification log are kept.
     */
    private StoreType storeType = StoreType.MEMORY;

    public enum StoreType {
        MEMORY,
        JDBC
    }

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

    public StoreType getStoreType() {
        return storeType;
    }

    public void setStoreType(StoreType storeType) {
        this.storeType = storeType;
    }
}

package com.geoledger.core.config;

/**
 * Raised while assembling a pipeline when a required setting is missing or invalid.
 */
public class ConfigurationException extends RuntimeException {
    private final String setting;

    public ConfigurationException(String setting, String message) {
        super(message);
        this.setting = setting;
    }

    public ConfigurationException(String setting, String message, Throwable cause) {
        super(message, cause);
        this.setting = setting;
    }

    public static ConfigurationException missing(String setting) {
        return new ConfigurationException(setting, "Missing required config key: " + setting);
    }

    public String setting() {
        return setting;
    }
}

package com.github.stormino.videoconverter.exception;

/**
 * A configuration value the converter cannot work with.
 */
public class ConfigurationException extends ConversionException {

    private final String configKey;

    /**
     * @param message What is wrong with the value
     * @param configKey Property the value came from, e.g. {@code converter.scheduler.max-concurrent}
     * @param configValue Rejected value
     */
    public ConfigurationException(String message, String configKey, Object configValue) {
        super(message + " (" + configKey + "=" + configValue + ")");
        this.configKey = configKey;
    }

    public String getConfigKey() {
        return configKey;
    }
}

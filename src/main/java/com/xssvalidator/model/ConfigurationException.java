package com.xssvalidator.model;

/**
 * Raised synchronously to the configuring caller when a setting cannot be applied.
 */
public class ConfigurationException extends Exception {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    /** The configuration key that was rejected. */
    public String getKey() { return key; }
}

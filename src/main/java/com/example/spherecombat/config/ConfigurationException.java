package com.example.spherecombat.config;

/**
 * Timing configuration is missing or malformed. Fatal to engine startup.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

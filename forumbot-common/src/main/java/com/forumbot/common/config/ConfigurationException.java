package com.forumbot.common.config;

/**
 * A required setting is missing; the process cannot start.
 */
public class ConfigurationException extends RuntimeException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

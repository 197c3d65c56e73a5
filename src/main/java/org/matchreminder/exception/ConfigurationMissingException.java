package org.matchreminder.exception;

/**
 * A required configuration value is absent.
 */
public class ConfigurationMissingException extends ReminderBotException {

    private final String key;

    public ConfigurationMissingException(String key) {
        super("Required configuration value " + key + " is not set");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

package org.matchreminder.exception;

/**
 * Base exception for reminder bot errors.
 */
public class ReminderBotException extends RuntimeException {

    public ReminderBotException(String message) {
        super(message);
    }

    public ReminderBotException(String message, Throwable cause) {
        super(message, cause);
    }
}

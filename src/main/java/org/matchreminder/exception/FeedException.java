package org.matchreminder.exception;

/**
 * The fixture feed could not be used for this cycle.
 */
public class FeedException extends ReminderBotException {

    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}

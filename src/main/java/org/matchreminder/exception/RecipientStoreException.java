package org.matchreminder.exception;

public class RecipientStoreException extends ReminderBotException {

    public RecipientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

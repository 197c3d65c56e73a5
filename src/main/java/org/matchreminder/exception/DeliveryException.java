package org.matchreminder.exception;

public class DeliveryException extends ReminderBotException {

    private final String recipientId;

    public DeliveryException(String recipientId, String message, Throwable cause) {
        super(message, cause);
        this.recipientId = recipientId;
    }

    public String getRecipientId() {
        return recipientId;
    }
}

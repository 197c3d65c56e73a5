package org.matchreminder.notify;

import org.matchreminder.exception.DeliveryException;

/**
 * Outbound side of the messaging platform.
 */
public interface DeliveryChannel {

    /**
     * Sends a plain text message to one recipient.
     *
     * @throws DeliveryException when the platform refuses or cannot deliver the message
     */
    void send(String recipientId, String text);
}

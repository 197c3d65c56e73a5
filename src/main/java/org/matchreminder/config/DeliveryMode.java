package org.matchreminder.config;

import java.util.Locale;

/**
 * How inbound Telegram updates reach the process.
 */
public enum DeliveryMode {
    POLLING,
    WEBHOOK;

    public static DeliveryMode parse(String value) {
        try {
            return DeliveryMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("DELIVERY_MODE must be 'polling' or 'webhook', got: " + value, e);
        }
    }
}

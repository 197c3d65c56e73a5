package org.matchreminder.recipients;

import java.util.Set;

/**
 * The set of chats that receive reminders. Implementations must be safe for concurrent use.
 */
public interface RecipientRegistry {

    /**
     * Adds a recipient; no-op if already present.
     *
     * @return {@code true} if the recipient was not registered before
     */
    boolean add(String recipientId);

    /**
     * Removes a recipient; no-op if absent.
     *
     * @return {@code true} if the recipient was registered
     */
    boolean remove(String recipientId);

    /**
     * Snapshot of the current recipients.
     */
    Set<String> list();
}

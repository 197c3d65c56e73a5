package org.matchreminder.recipients;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRecipientRegistry implements RecipientRegistry {
    private final Set<String> recipients = ConcurrentHashMap.newKeySet();

    @Override
    public boolean add(String recipientId) {
        return recipients.add(recipientId);
    }

    @Override
    public boolean remove(String recipientId) {
        return recipients.remove(recipientId);
    }

    @Override
    public Set<String> list() {
        return Set.copyOf(recipients);
    }
}

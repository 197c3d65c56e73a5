package org.matchreminder.schedule;

import java.time.Duration;
import java.util.Objects;

/**
 * Identity of a reminder: one per fixture and lead time.
 */
public final class ReminderKey {
    private final String eventId;
    private final Duration leadTime;

    public ReminderKey(String eventId, Duration leadTime) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.leadTime = Objects.requireNonNull(leadTime, "leadTime");
    }

    public String getEventId() {
        return eventId;
    }

    public Duration getLeadTime() {
        return leadTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReminderKey)) return false;
        ReminderKey that = (ReminderKey) o;
        return eventId.equals(that.eventId) && leadTime.equals(that.leadTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, leadTime);
    }

    @Override
    public String toString() {
        return eventId + "/" + leadTime.toHours() + "h";
    }
}

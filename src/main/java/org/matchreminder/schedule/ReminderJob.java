package org.matchreminder.schedule;

import org.matchreminder.fixtures.Fixture;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A planned reminder: fire {@code leadTime} before the fixture kicks off.
 * <p>
 * Immutable; the scheduler tracks firing state separately so the same plan can be installed again.
 */
public final class ReminderJob {

    /**
     * Fire instant first, then event id, then the longer lead time first.
     */
    public static final Comparator<ReminderJob> BY_FIRE_TIME = Comparator
            .comparing(ReminderJob::getFireAt)
            .thenComparing(job -> job.getKey().getEventId())
            .thenComparing(job -> job.getKey().getLeadTime(), Comparator.reverseOrder());

    private final ReminderKey key;
    private final Fixture fixture;
    private final Instant fireAt;

    public ReminderJob(Fixture fixture, Duration leadTime) {
        this.fixture = Objects.requireNonNull(fixture, "fixture");
        Objects.requireNonNull(fixture.getKickoff(), "fixture kickoff");
        this.key = new ReminderKey(fixture.getId(), leadTime);
        this.fireAt = fixture.getKickoff().toInstant().minus(leadTime);
    }

    public ReminderKey getKey() {
        return key;
    }

    public Fixture getFixture() {
        return fixture;
    }

    public Duration getLeadTime() {
        return key.getLeadTime();
    }

    public Instant getFireAt() {
        return fireAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReminderJob)) return false;
        ReminderJob that = (ReminderJob) o;
        return key.equals(that.key) && fireAt.equals(that.fireAt) && fixture.equals(that.fixture);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, fireAt);
    }

    @Override
    public String toString() {
        return "ReminderJob{" + key + " at " + fireAt + "}";
    }
}

package org.matchreminder.schedule;

import java.util.List;

/**
 * Output of {@link ReminderPlanner#plan}: the jobs in fire order, plus how many fixtures were
 * dropped for lacking a usable kickoff.
 */
public final class ReminderPlan {
    private final List<ReminderJob> jobs;
    private final int droppedEvents;

    public ReminderPlan(List<ReminderJob> jobs, int droppedEvents) {
        this.jobs = List.copyOf(jobs);
        this.droppedEvents = droppedEvents;
    }

    public List<ReminderJob> getJobs() {
        return jobs;
    }

    public int getDroppedEvents() {
        return droppedEvents;
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }
}

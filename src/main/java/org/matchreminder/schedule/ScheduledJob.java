package org.matchreminder.schedule;

import java.util.concurrent.atomic.AtomicReference;

/**
 * A reminder installed in the scheduler as part of one generation.
 */
final class ScheduledJob {
    private final ReminderJob job;
    private final long generation;
    private final FireCallback callback;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.PENDING);

    ScheduledJob(ReminderJob job, long generation, FireCallback callback) {
        this.job = job;
        this.generation = generation;
        this.callback = callback;
    }

    ReminderJob job() {
        return job;
    }

    long generation() {
        return generation;
    }

    FireCallback callback() {
        return callback;
    }

    JobState state() {
        return state.get();
    }

    boolean transition(JobState from, JobState to) {
        return state.compareAndSet(from, to);
    }
}

package org.matchreminder.schedule;

/**
 * Result of one {@link ResyncController#runCycle()}.
 */
public final class ResyncOutcome {
    private final boolean installed;
    private final long generation;
    private final int jobCount;
    private final int droppedEvents;
    private final String failure;

    private ResyncOutcome(boolean installed, long generation, int jobCount, int droppedEvents, String failure) {
        this.installed = installed;
        this.generation = generation;
        this.jobCount = jobCount;
        this.droppedEvents = droppedEvents;
        this.failure = failure;
    }

    static ResyncOutcome installed(long generation, int jobCount, int droppedEvents) {
        return new ResyncOutcome(true, generation, jobCount, droppedEvents, null);
    }

    static ResyncOutcome skipped(long keptGeneration, String failure) {
        return new ResyncOutcome(false, keptGeneration, 0, 0, failure);
    }

    /**
     * {@code false} when the fetch failed and the previous schedule was kept.
     */
    public boolean isInstalled() {
        return installed;
    }

    /**
     * The generation active after the cycle.
     */
    public long getGeneration() {
        return generation;
    }

    public int getJobCount() {
        return jobCount;
    }

    public int getDroppedEvents() {
        return droppedEvents;
    }

    public String getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return installed
                ? "installed generation " + generation + " (" + jobCount + " reminders, " + droppedEvents + " dropped)"
                : "kept generation " + generation + " (" + failure + ")";
    }
}

package org.matchreminder.schedule;

/**
 * Lifecycle of a scheduled reminder. {@link #FIRED} and {@link #CANCELLED} are terminal.
 */
public enum JobState {
    PENDING,
    FIRING,
    FIRED,
    CANCELLED
}

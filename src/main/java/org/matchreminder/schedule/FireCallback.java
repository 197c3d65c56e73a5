package org.matchreminder.schedule;

/**
 * Invoked by {@link JobScheduler} when a reminder becomes due.
 */
@FunctionalInterface
public interface FireCallback {

    void onFire(ReminderJob job);
}

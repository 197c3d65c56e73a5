package org.matchreminder.notify;

import java.util.List;

/**
 * Outcome of fanning one reminder out to the recipients.
 */
public final class DispatchReport {
    private final int successes;
    private final List<String> failedRecipients;

    public DispatchReport(int successes, List<String> failedRecipients) {
        this.successes = successes;
        this.failedRecipients = List.copyOf(failedRecipients);
    }

    public int getSuccesses() {
        return successes;
    }

    public int getFailures() {
        return failedRecipients.size();
    }

    public List<String> getFailedRecipients() {
        return failedRecipients;
    }

    public int getAttempted() {
        return successes + failedRecipients.size();
    }

    @Override
    public String toString() {
        return successes + " delivered, " + failedRecipients.size() + " failed";
    }
}

package org.matchreminder.notify;

import org.matchreminder.fixtures.Fixture;
import org.matchreminder.recipients.RecipientRegistry;
import org.matchreminder.schedule.FireCallback;
import org.matchreminder.schedule.ReminderJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Sends a due reminder to every subscriber.
 * <p>
 * The recipient list is read when the reminder fires, never earlier. A failure for one recipient
 * is logged and counted; the others still get the message.
 */
public class NotificationDispatcher implements FireCallback {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final DateTimeFormatter KICKOFF_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ENGLISH);

    private final RecipientRegistry registry;
    private final DeliveryChannel channel;
    private final String teamName;

    public NotificationDispatcher(RecipientRegistry registry, DeliveryChannel channel, String teamName) {
        this.registry = registry;
        this.channel = channel;
        this.teamName = teamName;
    }

    @Override
    public void onFire(ReminderJob job) {
        dispatch(job);
    }

    public DispatchReport dispatch(ReminderJob job) {
        String text;
        Set<String> recipients;
        try {
            text = formatMessage(job);
            recipients = registry.list();
        } catch (RuntimeException e) {
            log.error("Cannot prepare reminder {}", job.getKey(), e);
            return new DispatchReport(0, List.of());
        }

        int successes = 0;
        List<String> failed = new ArrayList<>();
        for (String recipient : recipients) {
            try {
                channel.send(recipient, text);
                successes++;
            } catch (RuntimeException e) {
                failed.add(recipient);
                log.warn("Could not deliver reminder {} to {}: {}", job.getKey(), recipient, e.getMessage());
            }
        }

        DispatchReport report = new DispatchReport(successes, failed);
        log.info("Reminder {} dispatched: {}", job.getKey(), report);
        return report;
    }

    public String formatMessage(ReminderJob job) {
        Fixture fixture = job.getFixture();
        return String.format("Reminder: %s match against %s (%s) at %s in %d hours!",
                teamName,
                fixture.getOpponent().getName(),
                fixture.getCompetition().getDisplayName(),
                fixture.getKickoff().format(KICKOFF_FORMAT),
                job.getLeadTime().toHours());
    }
}

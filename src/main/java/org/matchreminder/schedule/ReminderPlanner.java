package org.matchreminder.schedule;

import org.matchreminder.fixtures.Fixture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns fixtures into reminder jobs that are still in the future.
 * <p>
 * The result depends only on the arguments, so planning the same input twice yields equal plans.
 */
public class ReminderPlanner {
    private static final Logger log = LoggerFactory.getLogger(ReminderPlanner.class);

    public ReminderPlan plan(Collection<Fixture> fixtures, Instant now, Collection<Duration> leadTimes) {
        List<Duration> leads = new ArrayList<>(new HashSet<>(leadTimes));
        leads.sort(Comparator.reverseOrder());

        Map<ReminderKey, ReminderJob> jobs = new LinkedHashMap<>();
        Set<String> seenEvents = new HashSet<>();
        int dropped = 0;

        for (Fixture fixture : fixtures) {
            if (fixture.getKickoff() == null) {
                log.warn("Dropping fixture {} without a kickoff time", fixture.getId());
                dropped++;
                continue;
            }
            // the feed may list a match twice; the first occurrence wins
            if (!seenEvents.add(fixture.getId())) {
                continue;
            }
            if (!fixture.getKickoff().toInstant().isAfter(now)) {
                continue;
            }
            for (Duration lead : leads) {
                ReminderJob job = new ReminderJob(fixture, lead);
                if (job.getFireAt().isAfter(now)) {
                    jobs.putIfAbsent(job.getKey(), job);
                }
            }
        }

        List<ReminderJob> ordered = new ArrayList<>(jobs.values());
        ordered.sort(ReminderJob.BY_FIRE_TIME);
        return new ReminderPlan(ordered, dropped);
    }
}

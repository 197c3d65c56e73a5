package org.matchreminder.schedule;

import org.matchreminder.exception.FeedException;
import org.matchreminder.fixtures.Fixture;
import org.matchreminder.fixtures.FixtureSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Rebuilds the reminder schedule from the fixture feed: once at startup, then every day at a
 * fixed local time.
 * <p>
 * A failed fetch leaves the installed schedule alone. A successful fetch always replaces it, even
 * when the feed legitimately lists no matches.
 */
public class ResyncController implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResyncController.class);

    private final FixtureSource fixtureSource;
    private final ReminderPlanner planner;
    private final JobScheduler scheduler;
    private final List<Duration> leadTimes;
    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime dailyAt;
    private final ScheduledExecutorService timer;

    private volatile List<Fixture> latestFixtures = List.of();

    public ResyncController(FixtureSource fixtureSource, ReminderPlanner planner, JobScheduler scheduler,
                            List<Duration> leadTimes, Clock clock, ZoneId zone, LocalTime dailyAt) {
        this.fixtureSource = fixtureSource;
        this.planner = planner;
        this.scheduler = scheduler;
        this.leadTimes = List.copyOf(leadTimes);
        this.clock = clock;
        this.zone = zone;
        this.dailyAt = dailyAt;
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "resync-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Fetches, plans and installs a new schedule generation.
     */
    public synchronized ResyncOutcome runCycle() {
        log.info("Updating match schedule...");
        List<Fixture> fixtures;
        try {
            fixtures = fixtureSource.fetch();
        } catch (FeedException e) {
            log.warn("Fixture fetch failed, keeping schedule generation {}: {}",
                    scheduler.currentGeneration(), e.getMessage());
            return ResyncOutcome.skipped(scheduler.currentGeneration(), e.getMessage());
        }

        ReminderPlan plan = planner.plan(fixtures, clock.instant(), leadTimes);
        if (plan.getDroppedEvents() > 0) {
            log.warn("{} fixtures had no usable kickoff time and were skipped", plan.getDroppedEvents());
        }
        for (ReminderJob job : plan.getJobs()) {
            log.info("Scheduled {}h reminder for {} against {} (runs at {})",
                    job.getLeadTime().toHours(), job.getFixture().getKickoff(),
                    job.getFixture().getOpponent(), job.getFireAt().atZone(zone));
        }
        long generation = scheduler.resyncTo(plan.getJobs());
        latestFixtures = List.copyOf(fixtures);

        ResyncOutcome outcome = ResyncOutcome.installed(generation, plan.getJobs().size(), plan.getDroppedEvents());
        log.info("Schedule updated: {}", outcome);
        return outcome;
    }

    /**
     * Fixtures of the last successful fetch.
     */
    public List<Fixture> getLatestFixtures() {
        return latestFixtures;
    }

    /**
     * Runs a cycle now and schedules the daily ones.
     */
    public void start() {
        timer.execute(this::runCycleSafely);
        scheduleNextDaily();
    }

    private void scheduleNextDaily() {
        if (timer.isShutdown()) {
            return;
        }
        Duration delay = delayUntilNextRun(clock.instant());
        log.info("Next schedule update in {} minutes", delay.toMinutes());
        timer.schedule(() -> {
            runCycleSafely();
            scheduleNextDaily();
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    Duration delayUntilNextRun(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        ZonedDateTime next = local.toLocalDate().atTime(dailyAt).atZone(zone);
        if (!next.isAfter(local)) {
            next = local.toLocalDate().plusDays(1).atTime(dailyAt).atZone(zone);
        }
        return Duration.between(local, next);
    }

    private void runCycleSafely() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("Schedule update failed", e);
        }
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }
}

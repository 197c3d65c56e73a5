package org.matchreminder.schedule;

import org.matchreminder.support.Fixtures;
import org.matchreminder.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobScheduler}, driven through {@link JobScheduler#fireDueJobs()} with a
 * controllable clock.
 */
class JobSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-02-22T07:00:00Z");
    private static final List<Duration> LEADS = List.of(Duration.ofHours(7), Duration.ofHours(5), Duration.ofHours(2));

    private MutableClock clock;
    private List<ReminderJob> fired;
    private JobScheduler scheduler;
    private List<ReminderJob> planA;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, Fixtures.ZONE);
        fired = new CopyOnWriteArrayList<>();
        scheduler = new JobScheduler(clock, Runnable::run, fired::add);
        planA = new ReminderPlanner()
                .plan(List.of(Fixtures.homeMatch("A", NOW.plus(Duration.ofHours(12)))), NOW, LEADS)
                .getJobs();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Nested
    @DisplayName("firing")
    class Firing {

        @Test
        @DisplayName("nothing fires before its instant")
        void notBeforeDue() {
            scheduler.resyncTo(planA);

            clock.advance(Duration.ofHours(5).minusSeconds(1));

            assertThat(scheduler.fireDueJobs()).isZero();
            assertThat(fired).isEmpty();
        }

        @Test
        @DisplayName("due jobs fire once, in fire order")
        void firesInOrderOnce() {
            scheduler.resyncTo(planA);

            clock.advance(Duration.ofHours(11));
            scheduler.fireDueJobs();
            scheduler.fireDueJobs();

            assertThat(fired).containsExactlyElementsOf(planA);
            assertThat(scheduler.pendingJobs()).isEmpty();
        }

        @Test
        @DisplayName("jobs are handed over in non-decreasing fire order across events")
        void orderAcrossEvents() {
            List<ReminderJob> jobs = new ArrayList<>(new ReminderPlanner().plan(List.of(
                    Fixtures.homeMatch("A", NOW.plus(Duration.ofHours(12))),
                    Fixtures.homeMatch("B", NOW.plus(Duration.ofHours(9)))), NOW, LEADS).getJobs());
            Collections.reverse(jobs);
            scheduler.resyncTo(jobs);

            clock.advance(Duration.ofDays(1));
            scheduler.fireDueJobs();

            assertThat(fired).hasSize(6).isSortedAccordingTo(ReminderJob.BY_FIRE_TIME);
        }

        @Test
        @DisplayName("a failing callback does not stop other due jobs")
        void callbackFailureIsolated() {
            List<ReminderJob> survivors = new CopyOnWriteArrayList<>();
            JobScheduler failing = new JobScheduler(clock, Runnable::run, job -> {
                if (job.getLeadTime().equals(Duration.ofHours(7))) {
                    throw new IllegalStateException("boom");
                }
                survivors.add(job);
            });
            failing.resyncTo(planA);

            clock.advance(Duration.ofHours(11));
            assertThat(failing.fireDueJobs()).isEqualTo(3);

            assertThat(survivors).extracting(ReminderJob::getLeadTime)
                    .containsExactly(Duration.ofHours(5), Duration.ofHours(2));
            assertThat(failing.pendingJobs()).isEmpty();
        }

        @Test
        @DisplayName("jobs due together run in fire order inside one dispatch task")
        void batchRunsSequentially() {
            List<Runnable> handedOver = new ArrayList<>();
            JobScheduler deferred = new JobScheduler(clock, handedOver::add, fired::add);
            deferred.resyncTo(planA);

            clock.advance(Duration.ofHours(11));
            assertThat(deferred.fireDueJobs()).isEqualTo(3);

            assertThat(handedOver).hasSize(1);
            handedOver.get(0).run();
            assertThat(fired).containsExactlyElementsOf(planA);
        }

        @Test
        @DisplayName("a rejected batch is completed and not retried")
        void rejectedBatchCompleted() {
            JobScheduler rejecting = new JobScheduler(clock, task -> {
                throw new RejectedExecutionException("shut down");
            }, fired::add);
            rejecting.resyncTo(planA);

            clock.advance(Duration.ofHours(11));
            assertThat(rejecting.fireDueJobs()).isEqualTo(3);

            assertThat(fired).isEmpty();
            assertThat(rejecting.stateOf(planA.get(0).getKey())).isEmpty();
            assertThat(rejecting.fireDueJobs()).isZero();
        }

        @Test
        @DisplayName("the clock thread fires due jobs on its own")
        void clockThreadFires() throws InterruptedException {
            CountDownLatch latch = new CountDownLatch(1);
            JobScheduler live = new JobScheduler(clock, Runnable::run, job -> latch.countDown());
            clock.advance(Duration.ofHours(5));
            live.resyncTo(planA);
            live.start();
            try {
                assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            } finally {
                live.close();
            }
        }
    }

    @Nested
    @DisplayName("generations")
    class Generations {

        @Test
        @DisplayName("resyncing twice with the same plan keeps exactly that plan")
        void resyncSamePlanTwice() {
            long first = scheduler.resyncTo(planA);
            long second = scheduler.resyncTo(planA);

            assertThat(second).isEqualTo(first + 1);
            assertThat(scheduler.currentGeneration()).isEqualTo(second);
            assertThat(scheduler.pendingJobs()).containsExactlyElementsOf(planA);

            clock.advance(Duration.ofHours(11));
            scheduler.fireDueJobs();

            assertThat(fired).containsExactlyElementsOf(planA);
        }

        @Test
        @DisplayName("a job cancelled before its instant never fires")
        void cancelledNeverFires() {
            scheduler.resyncTo(planA);
            ReminderKey key = planA.get(0).getKey();

            assertThat(scheduler.cancelGeneration()).isEqualTo(3);
            clock.advance(Duration.ofHours(11));

            assertThat(scheduler.fireDueJobs()).isZero();
            assertThat(fired).isEmpty();
            assertThat(scheduler.stateOf(key)).isEmpty();
        }

        @Test
        @DisplayName("a job already firing completes after its generation is superseded")
        void inFlightCompletes() {
            List<Runnable> handedOver = new ArrayList<>();
            Executor capturing = handedOver::add;
            JobScheduler deferred = new JobScheduler(clock, capturing, fired::add);
            deferred.resyncTo(planA);

            clock.advance(Duration.ofHours(5));
            assertThat(deferred.fireDueJobs()).isEqualTo(1);
            ReminderKey firing = planA.get(0).getKey();
            assertThat(deferred.stateOf(firing)).contains(JobState.FIRING);

            deferred.resyncTo(planA.subList(1, 3));
            handedOver.forEach(Runnable::run);

            assertThat(fired).containsExactly(planA.get(0));
            assertThat(deferred.stateOf(firing)).isEmpty();
        }

        @Test
        @DisplayName("a key that is firing is not installed again by a resync")
        void noDoubleFireAcrossResync() {
            List<Runnable> handedOver = new ArrayList<>();
            JobScheduler deferred = new JobScheduler(clock, handedOver::add, fired::add);
            deferred.resyncTo(planA);

            clock.advance(Duration.ofHours(5));
            deferred.fireDueJobs();
            deferred.resyncTo(planA);
            deferred.fireDueJobs();
            handedOver.forEach(Runnable::run);

            assertThat(fired).containsExactly(planA.get(0));
            assertThat(deferred.pendingJobs()).containsExactlyElementsOf(planA.subList(1, 3));
        }

        @Test
        @DisplayName("jobs missing from the new generation are dropped")
        void supersededJobsDropped() {
            scheduler.resyncTo(planA);
            scheduler.resyncTo(List.of());

            clock.advance(Duration.ofDays(1));
            scheduler.fireDueJobs();

            assertThat(fired).isEmpty();
            assertThat(scheduler.pendingJobs()).isEmpty();
        }

        @Test
        void scheduleAllRejectsStaleGeneration() {
            scheduler.scheduleAll(3, planA, fired::add);

            assertThatThrownBy(() -> scheduler.scheduleAll(3, planA, fired::add))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(scheduler.resyncTo(planA)).isEqualTo(4);
        }

        @Test
        @DisplayName("installing a new generation cancels pending jobs of the old one")
        void scheduleAllSupersedes() {
            List<ReminderJob> other = new ArrayList<>();
            scheduler.scheduleAll(1, planA, fired::add);
            scheduler.scheduleAll(2, planA.subList(2, 3), other::add);

            clock.advance(Duration.ofHours(11));
            scheduler.fireDueJobs();

            assertThat(fired).isEmpty();
            assertThat(other).containsExactly(planA.get(2));
        }
    }
}

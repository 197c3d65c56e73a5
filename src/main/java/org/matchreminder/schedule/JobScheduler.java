package org.matchreminder.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the pending reminders and fires them when they become due.
 * <p>
 * Reminders are installed in <em>generations</em>. Only the installed generation may fire, and
 * {@link #resyncTo(Collection)} swaps generations inside one critical section: once it returns,
 * no pending job of the old generation can start, and a key present in both generations is
 * fired at most once. A job that already started firing is never interrupted.
 * <p>
 * A single clock thread sleeps until the earliest fire instant and hands each batch of due jobs
 * to the dispatch executor as one task that fires them in order. Batches themselves may overlap
 * when a dispatch outlasts the next fire instant. Tests drive {@link #fireDueJobs()} directly instead.
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private static final Duration MAX_IDLE_WAIT = Duration.ofMinutes(1);

    private static final Comparator<ScheduledJob> QUEUE_ORDER =
            Comparator.comparing(ScheduledJob::job, ReminderJob.BY_FIRE_TIME);

    private final Clock clock;
    private final Executor dispatchExecutor;
    private final FireCallback defaultCallback;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();

    // guarded by lock
    private final Map<ReminderKey, ScheduledJob> installed = new LinkedHashMap<>();
    private final PriorityQueue<ScheduledJob> queue = new PriorityQueue<>(QUEUE_ORDER);
    private long generation;
    private boolean running;
    private Thread clockThread;

    public JobScheduler(Clock clock, Executor dispatchExecutor, FireCallback defaultCallback) {
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
        this.defaultCallback = defaultCallback;
    }

    /**
     * Installs {@code jobs} as generation {@code newGeneration}, fired through {@code fireCallback}.
     * <p>
     * The generation must be newer than the installed one. Any job of an older generation that is
     * still pending is cancelled; a key that is currently firing is not installed again.
     */
    public void scheduleAll(long newGeneration, Collection<ReminderJob> jobs, FireCallback fireCallback) {
        lock.lock();
        try {
            if (newGeneration <= generation) {
                throw new IllegalStateException("Generation " + newGeneration
                        + " is not newer than installed generation " + generation);
            }
            supersedeOlderThan(newGeneration);
            generation = newGeneration;
            for (ReminderJob job : jobs) {
                ScheduledJob current = installed.get(job.getKey());
                if (current != null && (current.generation() == newGeneration || current.state() == JobState.FIRING)) {
                    continue;
                }
                ScheduledJob entry = new ScheduledJob(job, newGeneration, fireCallback);
                installed.put(job.getKey(), entry);
                queue.add(entry);
            }
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Supersedes the installed generation: none of its pending jobs will fire. Jobs already
     * firing run to completion.
     *
     * @return number of jobs cancelled
     */
    public int cancelGeneration() {
        lock.lock();
        try {
            int cancelled = supersedeOlderThan(generation + 1);
            wakeUp.signalAll();
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    private int supersedeOlderThan(long newGeneration) {
        int cancelled = 0;
        for (ScheduledJob entry : installed.values()) {
            if (entry.generation() < newGeneration && cancel(entry)) {
                cancelled++;
            }
        }
        installed.values().removeIf(entry -> entry.state() == JobState.CANCELLED);
        return cancelled;
    }

    /**
     * Replaces the installed generation with {@code jobs} in one step.
     *
     * @return the generation now installed
     */
    public long resyncTo(Collection<ReminderJob> jobs) {
        lock.lock();
        try {
            int cancelled = cancelGeneration();
            long next = generation + 1;
            scheduleAll(next, jobs, defaultCallback);
            log.info("Installed schedule generation {} with {} reminders ({} superseded)",
                    next, queue.size(), cancelled);
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fires every pending job of the installed generation whose fire instant has passed.
     *
     * The due jobs are run one after another, in fire order, within a single executor task.
     *
     * @return number of jobs handed to the dispatch executor
     */
    public int fireDueJobs() {
        List<ScheduledJob> due = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            while (!queue.isEmpty() && !queue.peek().job().getFireAt().isAfter(now)) {
                ScheduledJob entry = queue.poll();
                if (entry.generation() == generation && entry.transition(JobState.PENDING, JobState.FIRING)) {
                    due.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }

        if (due.isEmpty()) {
            return 0;
        }
        try {
            // one task per batch, so jobs due together also finish in fire order
            dispatchExecutor.execute(() -> due.forEach(this::run));
        } catch (RejectedExecutionException e) {
            log.error("Dispatch executor rejected {} due reminders, they will not be retried", due.size(), e);
            due.forEach(this::complete);
        }
        return due.size();
    }

    private void run(ScheduledJob entry) {
        ReminderJob job = entry.job();
        log.info("Firing reminder {} for {}", job.getKey(), job.getFixture());
        try {
            entry.callback().onFire(job);
        } catch (RuntimeException e) {
            log.error("Reminder {} failed while firing", job.getKey(), e);
        } finally {
            complete(entry);
        }
    }

    private void complete(ScheduledJob entry) {
        entry.transition(JobState.FIRING, JobState.FIRED);
        lock.lock();
        try {
            installed.remove(entry.job().getKey(), entry);
        } finally {
            lock.unlock();
        }
    }

    private boolean cancel(ScheduledJob entry) {
        if (entry.transition(JobState.PENDING, JobState.CANCELLED)) {
            queue.remove(entry);
            return true;
        }
        return false;
    }

    /**
     * Starts the clock thread. Calling it twice has no effect.
     */
    public void start() {
        lock.lock();
        try {
            if (running) {
                log.warn("Job scheduler is already running");
                return;
            }
            running = true;
            clockThread = new Thread(this::clockLoop, "reminder-clock");
            clockThread.setDaemon(true);
            clockThread.start();
        } finally {
            lock.unlock();
        }
    }

    private void clockLoop() {
        log.info("Reminder clock started");
        while (true) {
            fireDueJobs();
            lock.lock();
            try {
                if (!running) {
                    break;
                }
                long waitNanos = nanosUntilNextDue();
                if (waitNanos > 0) {
                    wakeUp.awaitNanos(waitNanos);
                }
                if (!running) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                lock.unlock();
            }
        }
        log.info("Reminder clock stopped");
    }

    private long nanosUntilNextDue() {
        ScheduledJob next = queue.peek();
        if (next == null) {
            return MAX_IDLE_WAIT.toNanos();
        }
        Duration untilDue = Duration.between(clock.instant(), next.job().getFireAt());
        if (untilDue.compareTo(MAX_IDLE_WAIT) > 0) {
            return MAX_IDLE_WAIT.toNanos();
        }
        return untilDue.isNegative() ? 0 : untilDue.toNanos();
    }

    @Override
    public void close() {
        Thread thread;
        lock.lock();
        try {
            running = false;
            wakeUp.signalAll();
            thread = clockThread;
            clockThread = null;
        } finally {
            lock.unlock();
        }
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public long currentGeneration() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Jobs of the installed generation that have not started firing, in fire order.
     */
    public List<ReminderJob> pendingJobs() {
        lock.lock();
        try {
            List<ReminderJob> pending = new ArrayList<>();
            for (ScheduledJob entry : queue) {
                if (entry.state() == JobState.PENDING) {
                    pending.add(entry.job());
                }
            }
            pending.sort(ReminderJob.BY_FIRE_TIME);
            return pending;
        } finally {
            lock.unlock();
        }
    }

    /**
     * State of the most recently installed job with this key, if the scheduler still tracks it.
     */
    public Optional<JobState> stateOf(ReminderKey key) {
        lock.lock();
        try {
            ScheduledJob entry = installed.get(key);
            return entry == null ? Optional.empty() : Optional.of(entry.state());
        } finally {
            lock.unlock();
        }
    }
}

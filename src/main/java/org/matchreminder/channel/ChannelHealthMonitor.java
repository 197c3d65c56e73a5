package org.matchreminder.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks that the webhook registration still points at this process and repairs it
 * when it does not.
 * <p>
 * A failed check is logged and retried on the next tick; the loop only stops on {@link #close()}.
 */
public class ChannelHealthMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChannelHealthMonitor.class);

    private final ChannelRegistrar registrar;
    private final String expectedTarget;
    private final Duration interval;
    private final ScheduledExecutorService ticker;

    private volatile RegistrationStatus status = RegistrationStatus.UNKNOWN;

    public ChannelHealthMonitor(ChannelRegistrar registrar, String expectedTarget, Duration interval) {
        this.registrar = registrar;
        this.expectedTarget = expectedTarget;
        this.interval = interval;
        this.ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "webhook-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the polling loop with an immediate first check.
     *
     * @return {@code false} if the monitor is disabled because no expected target is configured
     */
    public boolean start() {
        if (!isConfigured()) {
            log.error("WEBHOOK_URL is not set, webhook monitoring is disabled");
            return false;
        }
        ticker.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Webhook monitor checking every {}s", interval.toSeconds());
        return true;
    }

    private void tick() {
        try {
            checkOnce();
        } catch (RuntimeException e) {
            // keep the schedule alive; scheduleWithFixedDelay stops on an escaped exception
            log.error("Webhook check failed unexpectedly", e);
        }
    }

    /**
     * One check: query the registration and re-register if it drifted.
     */
    public RegistrationStatus checkOnce() {
        if (!isConfigured()) {
            return status;
        }
        Optional<String> current;
        try {
            current = registrar.currentTarget();
        } catch (Exception e) {
            log.warn("Could not query webhook registration: {}", e.getMessage());
            status = RegistrationStatus.UNKNOWN;
            return status;
        }

        if (current.isPresent() && current.get().equals(expectedTarget)) {
            if (status != RegistrationStatus.MATCHED) {
                log.info("Webhook registration is {}", expectedTarget);
            }
            status = RegistrationStatus.MATCHED;
            return status;
        }

        status = RegistrationStatus.MISMATCHED;
        log.warn("Webhook registration is '{}', expected '{}'; re-registering",
                current.orElse(""), expectedTarget);
        try {
            registrar.register(expectedTarget);
            status = RegistrationStatus.MATCHED;
            log.info("Webhook re-registered at {}", expectedTarget);
        } catch (Exception e) {
            log.warn("Webhook re-registration failed, retrying in {}s: {}", interval.toSeconds(), e.getMessage());
        }
        return status;
    }

    public RegistrationStatus getStatus() {
        return status;
    }

    public boolean isMatched() {
        return status == RegistrationStatus.MATCHED;
    }

    private boolean isConfigured() {
        return expectedTarget != null && !expectedTarget.isBlank();
    }

    @Override
    public void close() {
        ticker.shutdownNow();
    }
}

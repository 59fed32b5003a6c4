package org.cadsync.console.scheduler;

import org.cadsync.console.domain.model.ChangeSignal;
import org.cadsync.console.store.RefreshCoordinator;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduler for periodic store refreshes.
 * Polling backs up the realtime channel when notifications are lost.
 */
public final class RefreshScheduler {

    private static final Logger LOG = Logger.getLogger(RefreshScheduler.class.getName());

    private final ScheduledExecutorService executor;
    private final RefreshCoordinator refreshes;
    private final int intervalSeconds;
    private volatile boolean running = false;

    public RefreshScheduler(RefreshCoordinator refreshes, int intervalSeconds) {
        this.refreshes = Objects.requireNonNull(refreshes, "refreshes must not be null");

        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be at least 1");
        }
        this.intervalSeconds = intervalSeconds;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "refresh-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            LOG.warning("Refresh scheduler already running");
            return;
        }

        LOG.info(() -> "Starting refresh scheduler with interval: " + intervalSeconds + "s");
        executor.scheduleAtFixedRate(this::poll, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        running = true;
    }

    /**
     * Stop the scheduler.
     */
    public void stop() {
        if (!running) {
            return;
        }

        LOG.info("Stopping refresh scheduler");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    private void poll() {
        try {
            refreshes.requestRefresh(ChangeSignal.now(ChangeSignal.Source.POLL));
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Error requesting periodic refresh", e);
        }
    }
}

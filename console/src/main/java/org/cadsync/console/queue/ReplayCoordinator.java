package org.cadsync.console.queue;

import okhttp3.OkHttpClient;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs queue replays on one background thread.
 * <p>
 * Requests made while a pass is waiting to start share that pass. A pass stopped by a server or
 * auth failure is retried after a delay that doubles with each consecutive stop; a pass stopped by
 * a network failure waits for the connectivity monitor to report the service reachable again.
 */
public final class ReplayCoordinator {

    private static final Logger LOG = Logger.getLogger(ReplayCoordinator.class.getName());
    private static final int MAX_BACKOFF_SHIFT = 5;

    private final MutationQueue queue;
    private final OkHttpClient replayClient;
    private final ConnectivityMonitor connectivity;
    private final long retryDelayMillis;
    private final ScheduledExecutorService executor;
    private final List<Consumer<ReplayResult>> listeners = new CopyOnWriteArrayList<>();

    private CompletableFuture<ReplayResult> waiting;
    private int consecutiveStops = 0;

    public ReplayCoordinator(MutationQueue queue, OkHttpClient replayClient,
                             ConnectivityMonitor connectivity, long retryDelayMillis) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.replayClient = Objects.requireNonNull(replayClient, "replayClient must not be null");
        this.connectivity = Objects.requireNonNull(connectivity, "connectivity must not be null");
        if (retryDelayMillis < 1) {
            throw new IllegalArgumentException("retryDelayMillis must be at least 1");
        }
        this.retryDelayMillis = retryDelayMillis;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "queue-replay");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Called after every pass that did anything, e.g. to refresh the dispatch board.
     */
    public void addReplayListener(Consumer<ReplayResult> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Schedule a replay pass.
     */
    public synchronized CompletableFuture<ReplayResult> requestReplay() {
        if (waiting != null) {
            return waiting;
        }
        CompletableFuture<ReplayResult> future = new CompletableFuture<>();
        try {
            executor.execute(() -> runPass(future));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
            return future;
        }
        waiting = future;
        return future;
    }

    public void stop() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Delay before the given consecutive retry (1-based): the base delay doubled per retry, up to 32x.
     */
    long retryDelay(int retry) {
        int shift = Math.min(Math.max(retry - 1, 0), MAX_BACKOFF_SHIFT);
        return retryDelayMillis << shift;
    }

    private void scheduleRetry() {
        long delay = retryDelay(++consecutiveStops);
        try {
            executor.schedule(() -> {
                requestReplay();
            }, delay, TimeUnit.MILLISECONDS);
            LOG.info(() -> "[Queue] Retrying replay in " + delay + "ms");
        } catch (RejectedExecutionException e) {
            LOG.fine("[Queue] Replay retry dropped, coordinator stopped");
        }
    }

    private void runPass(CompletableFuture<ReplayResult> future) {
        synchronized (this) {
            waiting = null;
        }
        ReplayResult result;
        try {
            result = queue.replay(replayClient);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "[Queue] Replay pass failed", e);
            future.completeExceptionally(e);
            return;
        }

        if (result.getStopReason() == ReplayResult.StopReason.NETWORK) {
            consecutiveStops = 0;
            connectivity.reportUnreachable(null);
        } else if (result.isInterrupted()) {
            scheduleRetry();
        } else if (!result.isSkipped()) {
            consecutiveStops = 0;
        }

        if (result.getDelivered() > 0 || result.getFailed() > 0) {
            for (Consumer<ReplayResult> listener : listeners) {
                try {
                    listener.accept(result);
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "[Queue] Replay listener failed", e);
                }
            }
        }
        future.complete(result);
    }
}

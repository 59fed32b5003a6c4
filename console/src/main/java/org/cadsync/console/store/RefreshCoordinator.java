package org.cadsync.console.store;

import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.ChangeSignal;
import org.cadsync.console.domain.model.DispatchSnapshot;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single consumer of every refresh trigger: polling, realtime notifications, local mutations and
 * connectivity restoration all end up in {@link #requestRefresh(ChangeSignal)}.
 * <p>
 * Refreshes run one at a time. Requests arriving while a refresh is in flight share one follow-up
 * refresh, which starts after the running one and therefore observes everything that happened before it.
 */
public final class RefreshCoordinator {

    private static final Logger LOG = Logger.getLogger(RefreshCoordinator.class.getName());

    private final DispatchStateStore store;
    private final ExecutorService executor;
    private final AtomicLong completedRefreshes = new AtomicLong();

    private CompletableFuture<DispatchSnapshot> waiting;

    public RefreshCoordinator(DispatchStateStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "store-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Ask for the board to be re-fetched. The future completes with the snapshot of the refresh that
     * served this request, or exceptionally with its {@link DispatchException}.
     */
    public synchronized CompletableFuture<DispatchSnapshot> requestRefresh(ChangeSignal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        if (waiting != null) {
            LOG.finer(() -> "[Store] Refresh already pending, coalescing " + signal);
            return waiting;
        }
        CompletableFuture<DispatchSnapshot> future = new CompletableFuture<>();
        try {
            executor.execute(() -> run(future, signal));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
            return future;
        }
        waiting = future;
        return future;
    }

    /**
     * Request a refresh and wait for it. Failures were already delivered to snapshot listeners and
     * are only logged here.
     *
     * @return the refreshed snapshot, or the current one if the refresh failed or timed out
     */
    public DispatchSnapshot refreshAndWait(ChangeSignal signal, long timeoutMillis) {
        CompletableFuture<DispatchSnapshot> future = requestRefresh(signal);
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            LOG.fine(() -> "[Store] Refresh after " + signal.getSource() + " failed: " + e.getCause());
        } catch (TimeoutException e) {
            LOG.warning(() -> "[Store] Refresh after " + signal.getSource() + " still running after " + timeoutMillis + "ms");
        }
        return store.getSnapshot();
    }

    /**
     * Number of refreshes executed so far.
     */
    public long getCompletedRefreshes() {
        return completedRefreshes.get();
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

    private void run(CompletableFuture<DispatchSnapshot> future, ChangeSignal signal) {
        synchronized (this) {
            waiting = null;
        }
        try {
            LOG.fine(() -> "[Store] Refreshing after " + signal);
            future.complete(store.refresh());
        } catch (DispatchException e) {
            future.completeExceptionally(e);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "[Store] Unexpected refresh failure", e);
            future.completeExceptionally(e);
        } finally {
            completedRefreshes.incrementAndGet();
        }
    }
}

package org.cadsync.console.ui;

import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.AuditEvent;
import org.cadsync.console.domain.service.AuditTimelineReader;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the timeline of the selected call in the background.
 * <p>
 * Only the latest request reaches the view; a result for a call that is no longer selected is dropped.
 */
public final class TimelineLoader {

    private static final Logger LOG = Logger.getLogger(TimelineLoader.class.getName());

    /**
     * Where timeline states are rendered.
     */
    public interface View {
        /** Nothing selected. */
        void showPrompt();

        void showLoading(String callId);

        void showTimeline(String callId, List<AuditEvent> events);

        void showError(String callId, DispatchException error);
    }

    private final AuditTimelineReader reader;
    private final Executor executor;
    private final View view;
    private final AtomicLong generation = new AtomicLong();
    private CompletableFuture<List<AuditEvent>> inFlight;

    public TimelineLoader(AuditTimelineReader reader, Executor executor, View view) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.view = Objects.requireNonNull(view, "view must not be null");
    }

    /**
     * Show the timeline for a call, or the prompt when callId is null. Any earlier load is cancelled.
     */
    public synchronized CompletableFuture<List<AuditEvent>> show(String callId) {
        long token = generation.incrementAndGet();
        if (inFlight != null) {
            inFlight.cancel(false);
            inFlight = null;
        }
        if (callId == null) {
            view.showPrompt();
            return CompletableFuture.completedFuture(Collections.emptyList());
        }

        CompletableFuture<List<AuditEvent>> future = new CompletableFuture<>();
        inFlight = future;
        view.showLoading(callId);
        try {
            executor.execute(() -> load(callId, token, future));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    public CompletableFuture<List<AuditEvent>> clear() {
        return show(null);
    }

    private void load(String callId, long token, CompletableFuture<List<AuditEvent>> future) {
        if (future.isCancelled()) {
            return;
        }
        try {
            List<AuditEvent> events = reader.timelineFor(callId);
            if (isCurrent(token) && future.complete(events)) {
                view.showTimeline(callId, events);
            } else {
                LOG.fine(() -> "[Timeline] Dropping stale result for call " + callId);
            }
        } catch (DispatchException e) {
            if (isCurrent(token) && future.completeExceptionally(e)) {
                view.showError(callId, e);
            } else {
                LOG.fine(() -> "[Timeline] Dropping stale failure for call " + callId);
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "[Timeline] Unexpected failure loading call " + callId, e);
            future.completeExceptionally(e);
        }
    }

    private boolean isCurrent(long token) {
        return generation.get() == token;
    }
}

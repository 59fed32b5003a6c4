package org.cadsync.console;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.cadsync.console.api.CredentialProvider;
import org.cadsync.console.api.DispatchApiClient;
import org.cadsync.console.api.DispatchApiClientImpl;
import org.cadsync.console.api.DispatchException;
import org.cadsync.console.api.HttpClients;
import org.cadsync.console.config.ConsoleConfig;
import org.cadsync.console.config.LoggingSetup;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.domain.model.ChangeSignal;
import org.cadsync.console.domain.model.DispatchSnapshot;
import org.cadsync.console.domain.service.AssignmentService;
import org.cadsync.console.domain.service.AssignmentServiceImpl;
import org.cadsync.console.domain.service.AssignmentSource;
import org.cadsync.console.domain.service.AuditTimelineReader;
import org.cadsync.console.domain.service.AuditTimelineReaderImpl;
import org.cadsync.console.domain.service.StatusTransitionService;
import org.cadsync.console.domain.service.StatusTransitionServiceImpl;
import org.cadsync.console.queue.ConnectivityListener;
import org.cadsync.console.queue.ConnectivityMonitor;
import org.cadsync.console.queue.FileMutationQueueStore;
import org.cadsync.console.queue.MutationQueue;
import org.cadsync.console.queue.MutationQueueEntry;
import org.cadsync.console.queue.MutationQueueListener;
import org.cadsync.console.queue.OfflineQueueInterceptor;
import org.cadsync.console.queue.ReplayCoordinator;
import org.cadsync.console.queue.ReplayResult;
import org.cadsync.console.realtime.InvalidationChannel;
import org.cadsync.console.realtime.InvalidationListener;
import org.cadsync.console.scheduler.RefreshScheduler;
import org.cadsync.console.store.DispatchStateStore;
import org.cadsync.console.store.DispatchStateStoreImpl;
import org.cadsync.console.store.RefreshCoordinator;
import org.cadsync.console.ui.MapProjector;
import org.cadsync.console.ui.SelectionModel;
import org.cadsync.console.ui.TimelineLoader;
import org.cadsync.console.ui.TransitionShortcuts;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the dispatch console core.
 * <p>
 * Wires the HTTP clients, offline queue, state store, realtime channel and services together.
 * The board is refreshed on:
 * - start
 * - every realtime notification, and after every channel reconnect
 * - completion of every local mutation
 * - connectivity restoration, after the offline queue was replayed
 * - a polling interval, when enabled
 * <p>
 * Mutations run one at a time on a dedicated worker so they reach the server in the order issued.
 */
public final class DispatchConsole {

    private static final Logger LOG = Logger.getLogger(DispatchConsole.class.getName());

    /**
     * A mutation body that may fail with a classified error.
     */
    @FunctionalInterface
    interface MutationTask<T> {
        T run() throws DispatchException;
    }

    private final ConsoleConfig config;
    private final OkHttpClient baseClient;
    private final ConnectivityMonitor connectivity;
    private final MutationQueue queue;
    private final ReplayCoordinator replay;
    private final DispatchStateStore store;
    private final RefreshCoordinator refreshes;
    private final RefreshScheduler scheduler;
    private final InvalidationChannel channel;
    private final AssignmentService assignments;
    private final StatusTransitionService transitions;
    private final AuditTimelineReader timelineReader;
    private final SelectionModel selection = new SelectionModel();
    private final TransitionShortcuts shortcuts;
    private final MapProjector mapProjector = new MapProjector();
    private final ExecutorService mutationWorker;
    private final ExecutorService readWorker;
    private final long startupTimeoutMillis;
    private volatile boolean running = false;

    public DispatchConsole(ConsoleConfig config, CredentialProvider credentials) throws IOException {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");

        this.baseClient = HttpClients.authenticated(credentials,
                config.getConnectTimeoutSeconds(), config.getReadTimeoutSeconds());
        HttpUrl probeUrl = HttpUrl.get(config.getApiBaseUrl()).resolve(config.getHealthPath());
        if (probeUrl == null) {
            throw new IllegalArgumentException("Invalid health path: " + config.getHealthPath());
        }
        long probeIntervalMillis = TimeUnit.SECONDS.toMillis(config.getProbeIntervalSeconds());
        this.connectivity = new ConnectivityMonitor(baseClient, probeUrl, probeIntervalMillis);

        this.queue = new MutationQueue(new FileMutationQueueStore(config.getQueueFile()));
        OkHttpClient mutationClient = HttpClients.withOutermost(baseClient, new OfflineQueueInterceptor(queue, connectivity));
        DispatchApiClient apiClient = new DispatchApiClientImpl(config.getApiBaseUrl(), mutationClient);
        this.replay = new ReplayCoordinator(queue, baseClient, connectivity, probeIntervalMillis);

        this.store = new DispatchStateStoreImpl(apiClient);
        this.refreshes = new RefreshCoordinator(store);
        this.scheduler = config.isPollingEnabled()
                ? new RefreshScheduler(refreshes, config.getRefreshIntervalSeconds())
                : null;
        this.channel = new InvalidationChannel(baseClient, config.getRealtimeUrl(), config.getChannelUnit(),
                config.getReconnectDelayMillis(), config.getMaxReconnectDelayMillis());

        // a refresh is two reads
        long refreshTimeoutMillis = 2 * TimeUnit.SECONDS.toMillis(config.getReadTimeoutSeconds());
        this.startupTimeoutMillis = refreshTimeoutMillis;
        this.assignments = new AssignmentServiceImpl(apiClient, store, refreshes, refreshTimeoutMillis);
        this.transitions = new StatusTransitionServiceImpl(apiClient, store, refreshes, refreshTimeoutMillis);
        this.timelineReader = new AuditTimelineReaderImpl(apiClient);
        this.shortcuts = new TransitionShortcuts(selection, store, transitions);

        this.mutationWorker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mutation-worker");
            t.setDaemon(true);
            return t;
        });
        this.readWorker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "console-reads");
            t.setDaemon(true);
            return t;
        });

        wire();
    }

    /**
     * Creates a console from environment configuration and sets up logging.
     */
    public static DispatchConsole fromEnvironment(CredentialProvider credentials) throws IOException {
        ConsoleConfig config = ConsoleConfig.fromEnvironment();
        LoggingSetup.configure(config);
        LOG.info(() -> "Configuration: " + config);
        return new DispatchConsole(config, credentials);
    }

    private void wire() {
        connectivity.addListener(new ConnectivityListener() {
            @Override
            public void onOnline() {
                replay.requestReplay().whenComplete((result, error) ->
                        refreshes.requestRefresh(ChangeSignal.now(ChangeSignal.Source.CONNECTIVITY_RESTORED)));
            }
        });

        replay.addReplayListener(this::onReplayed);

        queue.addListener(new MutationQueueListener() {
            @Override
            public void onEnqueued(MutationQueueEntry entry) {
                if (connectivity.isOnline()) {
                    replay.requestReplay();
                }
            }

            @Override
            public void onFailed(MutationQueueEntry entry) {
                LOG.warning(() -> "[Queue] Mutation rejected on replay, awaiting review: " + entry);
            }
        });

        channel.addListener(new InvalidationListener() {
            @Override
            public void onInvalidation(ChangeSignal signal) {
                refreshes.requestRefresh(signal);
            }

            @Override
            public void onConnected() {
                connectivity.reportReachable();
            }
        });
    }

    /**
     * Load the board, then start polling, the realtime channel, connectivity probing and replay of
     * mutations left over from a previous session.
     */
    public synchronized void start() {
        if (running) {
            LOG.warning("Console already running");
            return;
        }
        LOG.info("=== CADSync dispatch console starting ===");

        DispatchSnapshot initial = refreshes.refreshAndWait(ChangeSignal.now(ChangeSignal.Source.STARTUP), startupTimeoutMillis);
        if (!store.isInitialized()) {
            LOG.warning("Initial load failed, board is empty until the next refresh");
        } else {
            LOG.info(() -> "Initial board loaded: " + initial);
        }

        if (scheduler != null) {
            scheduler.start();
        } else {
            LOG.info("Polling disabled");
        }
        channel.start();
        connectivity.start();

        if (queue.hasPending()) {
            LOG.info(() -> "[Queue] " + queue.pending().size() + " mutation(s) restored from disk, replaying");
            replay.requestReplay();
        }
        running = true;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        LOG.info("Shutting down console...");
        channel.stop();
        if (scheduler != null) {
            scheduler.stop();
        }
        connectivity.stop();
        shutdown(mutationWorker);
        shutdown(readWorker);
        replay.stop();
        refreshes.stop();
        baseClient.dispatcher().executorService().shutdown();
        baseClient.connectionPool().evictAll();
        running = false;
        LOG.info("Console shutdown complete");
    }

    public boolean isRunning() {
        return running;
    }

    // Asynchronous operations

    public CompletableFuture<Void> assign(String callId, String unitId, AssignmentSource source) {
        return submit(() -> {
            assignments.assign(callId, unitId, source);
            return null;
        });
    }

    public CompletableFuture<Void> transition(String callId, CallStatus target, String unitId) {
        return submit(() -> {
            transitions.transition(callId, target, unitId);
            return null;
        });
    }

    /**
     * Run the shortcut bound to a key against the current selection.
     *
     * @return completes with false when the key press was a no-op
     */
    public CompletableFuture<Boolean> handleShortcut(char key) {
        Optional<TransitionShortcuts.Action> action = shortcuts.resolve(key);
        if (!action.isPresent()) {
            return CompletableFuture.completedFuture(false);
        }
        TransitionShortcuts.Action a = action.get();
        return submit(() -> {
            transitions.transition(a.getCallId(), a.getTarget(), a.getUnitId());
            return true;
        });
    }

    /**
     * Re-fetch the board on demand, e.g. from a retry button on the stale-data banner.
     */
    public CompletableFuture<DispatchSnapshot> refresh() {
        return refreshes.requestRefresh(ChangeSignal.now(ChangeSignal.Source.POLL));
    }

    public TimelineLoader newTimelineLoader(TimelineLoader.View view) {
        return new TimelineLoader(timelineReader, readWorker, view);
    }

    /**
     * Drop a mutation the server rejected on replay.
     */
    public boolean discardFailedMutation(String entryId) throws IOException {
        return queue.discard(entryId);
    }

    // Accessors

    public ConsoleConfig getConfig() {
        return config;
    }

    public DispatchStateStore getStore() {
        return store;
    }

    public SelectionModel getSelection() {
        return selection;
    }

    public TransitionShortcuts getShortcuts() {
        return shortcuts;
    }

    public MapProjector getMapProjector() {
        return mapProjector;
    }

    public AssignmentService getAssignments() {
        return assignments;
    }

    public MutationQueue getMutationQueue() {
        return queue;
    }

    public List<MutationQueueEntry> getPendingMutations() {
        return queue.pending();
    }

    public boolean isOnline() {
        return connectivity.isOnline();
    }

    public boolean isLiveUpdatesConnected() {
        return channel.isConnected();
    }

    private void onReplayed(ReplayResult result) {
        LOG.info(() -> "[Queue] Replay finished: " + result);
        refreshes.requestRefresh(ChangeSignal.now(ChangeSignal.Source.LOCAL_MUTATION));
    }

    private <T> CompletableFuture<T> submit(MutationTask<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            mutationWorker.execute(() -> {
                try {
                    future.complete(task.run());
                } catch (DispatchException e) {
                    future.completeExceptionally(e);
                } catch (RuntimeException e) {
                    LOG.log(Level.SEVERE, "Unexpected mutation failure", e);
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private static void shutdown(ExecutorService executor) {
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
}

package org.cadsync.console.queue;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.cadsync.console.api.CredentialException;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks whether the dispatch service is reachable.
 * <p>
 * Traffic reports reachability as a side effect: any HTTP response means online, a transport
 * failure means offline. While offline a probe hits the health endpoint on a fixed interval.
 */
public final class ConnectivityMonitor {

    private static final Logger LOG = Logger.getLogger(ConnectivityMonitor.class.getName());

    private final OkHttpClient probeClient;
    private final HttpUrl probeUrl;
    private final long probeIntervalMillis;
    private final AtomicBoolean online = new AtomicBoolean(true);
    private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService executor;
    private volatile boolean running = false;

    public ConnectivityMonitor(OkHttpClient probeClient, HttpUrl probeUrl, long probeIntervalMillis) {
        this.probeClient = Objects.requireNonNull(probeClient, "probeClient must not be null");
        this.probeUrl = Objects.requireNonNull(probeUrl, "probeUrl must not be null");
        if (probeIntervalMillis < 1) {
            throw new IllegalArgumentException("probeIntervalMillis must be at least 1");
        }
        this.probeIntervalMillis = probeIntervalMillis;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "connectivity-probe");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(ConnectivityListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public boolean isOnline() {
        return online.get();
    }

    /**
     * The server answered something: the network path works.
     */
    public void reportReachable() {
        if (online.compareAndSet(false, true)) {
            LOG.info("[Connectivity] Dispatch service reachable again");
            for (ConnectivityListener listener : listeners) {
                notify(listener::onOnline);
            }
        }
    }

    /**
     * A request failed without a response.
     */
    public void reportUnreachable(Throwable cause) {
        if (online.compareAndSet(true, false)) {
            LOG.warning(() -> "[Connectivity] Dispatch service unreachable"
                    + (cause == null ? "" : ": " + cause.getMessage()));
            for (ConnectivityListener listener : listeners) {
                notify(listener::onOffline);
            }
        }
    }

    public void start() {
        if (running) {
            LOG.warning("Connectivity monitor already running");
            return;
        }
        executor.scheduleWithFixedDelay(this::probe, probeIntervalMillis, probeIntervalMillis, TimeUnit.MILLISECONDS);
        running = true;
    }

    public void stop() {
        if (!running) {
            return;
        }
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

    /**
     * Probe the health endpoint once if currently offline.
     */
    void probe() {
        if (online.get()) {
            return;
        }
        Request request = new Request.Builder().url(probeUrl).get().build();
        try (Response response = probeClient.newCall(request).execute()) {
            LOG.fine(() -> "[Connectivity] Probe answered " + response.code());
            reportReachable();
        } catch (CredentialException e) {
            LOG.warning(() -> "[Connectivity] Probe not sent: " + e.getMessage());
        } catch (IOException e) {
            LOG.fine(() -> "[Connectivity] Probe failed: " + e.getMessage());
        }
    }

    private static void notify(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "[Connectivity] Listener failed", e);
        }
    }
}

package org.cadsync.console.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.cadsync.console.domain.model.ChangeSignal;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WebSocket that tells the console when to re-fetch.
 * <p>
 * Message content is never interpreted: every frame, text or binary, becomes one
 * {@link ChangeSignal}. After a disconnect the socket is reopened with exponential backoff, the
 * unit scope is subscribed again and a {@link ChangeSignal.Source#RECONNECT} signal covers whatever
 * was missed while down.
 */
public final class InvalidationChannel {

    private static final Logger LOG = Logger.getLogger(InvalidationChannel.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient client;
    private final String url;
    private final String unitScope;
    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private final List<InvalidationListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService reconnector;

    private volatile WebSocket current;
    private volatile boolean connected = false;
    private volatile boolean stopped = false;
    private int failedAttempts = 0;
    private boolean everOpened = false;

    /**
     * @param unitScope unit to subscribe to on open, or null for the unscoped channel
     */
    public InvalidationChannel(OkHttpClient client, String url, String unitScope,
                               long initialDelayMillis, long maxDelayMillis) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.url = Objects.requireNonNull(url, "url must not be null");
        this.unitScope = unitScope;
        if (initialDelayMillis < 1 || maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException("reconnect delays must be positive and max >= initial");
        }
        this.initialDelayMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.reconnector = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "realtime-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(InvalidationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void start() {
        LOG.info(() -> "[Realtime] Connecting to " + url + (unitScope == null ? "" : " (unit " + unitScope + ")"));
        connect();
    }

    public void stop() {
        stopped = true;
        reconnector.shutdownNow();
        WebSocket socket = current;
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "console stopped");
        }
        connected = false;
    }

    /**
     * Backs the "live updates" indicator.
     */
    public boolean isConnected() {
        return connected;
    }

    /**
     * Delay before the given reconnect attempt (1-based).
     */
    long backoffDelay(int attempt) {
        long delay = initialDelayMillis;
        for (int i = 1; i < attempt && delay < maxDelayMillis; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxDelayMillis);
    }

    static String subscribeFrame(String unitId) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("action", "subscribe");
        frame.put("channel", "unit:" + unitId);
        return frame.toString();
    }

    private synchronized void connect() {
        if (stopped) {
            return;
        }
        Request request = new Request.Builder().url(url).build();
        current = client.newWebSocket(request, new Listener());
    }

    private synchronized void scheduleReconnect() {
        if (stopped) {
            return;
        }
        failedAttempts++;
        long delay = backoffDelay(failedAttempts);
        LOG.info(() -> "[Realtime] Reconnecting in " + delay + "ms (attempt " + failedAttempts + ")");
        try {
            reconnector.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.fine("[Realtime] Reconnect skipped, channel stopped");
        }
    }

    private void signal(ChangeSignal.Source source) {
        ChangeSignal signal = ChangeSignal.now(source);
        for (InvalidationListener listener : listeners) {
            try {
                listener.onInvalidation(signal);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "[Realtime] Listener failed", e);
            }
        }
    }

    private void notifyConnection(boolean up) {
        for (InvalidationListener listener : listeners) {
            try {
                if (up) {
                    listener.onConnected();
                } else {
                    listener.onDisconnected();
                }
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "[Realtime] Listener failed", e);
            }
        }
    }

    private void handleDown(WebSocket webSocket, String reason) {
        if (webSocket != current) {
            return;
        }
        boolean wasConnected = connected;
        connected = false;
        if (stopped) {
            return;
        }
        LOG.warning(() -> "[Realtime] Channel down: " + reason);
        if (wasConnected) {
            notifyConnection(false);
        }
        scheduleReconnect();
    }

    private final class Listener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            boolean reconnect;
            synchronized (InvalidationChannel.this) {
                if (webSocket != current || stopped) {
                    webSocket.close(NORMAL_CLOSURE, null);
                    return;
                }
                reconnect = everOpened || failedAttempts > 0;
                everOpened = true;
                failedAttempts = 0;
                connected = true;
            }
            if (unitScope != null) {
                webSocket.send(subscribeFrame(unitScope));
            }
            LOG.info(() -> "[Realtime] Channel open" + (reconnect ? " (reconnected)" : ""));
            notifyConnection(true);
            if (reconnect) {
                signal(ChangeSignal.Source.RECONNECT);
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            LOG.finer(() -> "[Realtime] Text frame: " + text);
            signal(ChangeSignal.Source.REMOTE_MESSAGE);
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            LOG.finer(() -> "[Realtime] Binary frame of " + bytes.size() + " bytes");
            signal(ChangeSignal.Source.REMOTE_MESSAGE);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            handleDown(webSocket, "closed " + code + (reason == null || reason.isEmpty() ? "" : " " + reason));
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            handleDown(webSocket, t.getClass().getSimpleName() + ": " + t.getMessage());
        }
    }
}

package org.cadsync.console.queue;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.cadsync.console.api.CredentialException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable FIFO of mutations that could not be delivered.
 * <p>
 * Every change to the entry list is written through to the {@link MutationQueueStore} before the
 * method returns. An entry leaves the queue only after the server accepted its replay.
 */
public final class MutationQueue {

    private static final Logger LOG = Logger.getLogger(MutationQueue.class.getName());

    /**
     * Replays answered with a server error before an entry is given up as failed.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final MutationQueueStore store;
    private final Clock clock;
    private final List<MutationQueueEntry> entries = new ArrayList<>();
    private final List<MutationQueueListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock replayLock = new ReentrantLock();
    private final int maxAttempts;
    private long nextSequence;

    public MutationQueue(MutationQueueStore store) throws IOException {
        this(store, Clock.systemUTC());
    }

    public MutationQueue(MutationQueueStore store, Clock clock) throws IOException {
        this(store, clock, DEFAULT_MAX_ATTEMPTS);
    }

    public MutationQueue(MutationQueueStore store, Clock clock, int maxAttempts) throws IOException {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;

        List<MutationQueueEntry> loaded = store.load();
        long maxSequence = 0;
        for (MutationQueueEntry entry : loaded) {
            if (entry.getStatus() == DeliveryStatus.DELIVERED) {
                continue;
            }
            entries.add(entry);
            maxSequence = Math.max(maxSequence, entry.getSequence());
        }
        entries.sort(MutationQueueEntry.FIFO);
        this.nextSequence = maxSequence + 1;
        if (!entries.isEmpty()) {
            LOG.info(() -> "[Queue] Restored " + entries.size() + " queued mutations");
        }
    }

    public void addListener(MutationQueueListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(MutationQueueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Persist a request for later replay.
     *
     * @param id      mutation id, sent as the Idempotency-Key on every replay
     * @param headers request headers; Authorization is never stored
     * @throws IOException if the entry could not be written to durable storage; the queue is unchanged
     */
    public MutationQueueEntry enqueue(String id, String method, String url, Map<String, String> headers,
                                      String body, String contentType) throws IOException {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");

        MutationQueueEntry entry;
        synchronized (this) {
            entry = new MutationQueueEntry(id, nextSequence, method, url, stripCredentials(headers),
                    body, contentType, clock.millis());
            entries.add(entry);
            try {
                persist();
            } catch (IOException e) {
                entries.remove(entry);
                throw e;
            }
            nextSequence++;
        }
        LOG.info(() -> "[Queue] Queued " + method + " " + url + " (id=" + id + ")");
        MutationQueueEntry snapshot = entry.copy();
        listeners.forEach(l -> l.onEnqueued(snapshot));
        return snapshot;
    }

    /**
     * Pending entries in replay order.
     */
    public synchronized List<MutationQueueEntry> pending() {
        return copyWithStatus(DeliveryStatus.PENDING);
    }

    /**
     * Entries the server refused on replay, kept until discarded.
     */
    public synchronized List<MutationQueueEntry> failed() {
        return copyWithStatus(DeliveryStatus.FAILED);
    }

    public synchronized boolean hasPending() {
        for (MutationQueueEntry entry : entries) {
            if (entry.getStatus() == DeliveryStatus.PENDING) {
                return true;
            }
        }
        return false;
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Drop an entry the dispatcher has reviewed. Only failed entries can be discarded.
     *
     * @return true if an entry was removed
     */
    public boolean discard(String id) throws IOException {
        synchronized (this) {
            Iterator<MutationQueueEntry> it = entries.iterator();
            while (it.hasNext()) {
                MutationQueueEntry entry = it.next();
                if (entry.getId().equals(id) && entry.getStatus() == DeliveryStatus.FAILED) {
                    it.remove();
                    persist();
                    LOG.info(() -> "[Queue] Discarded failed mutation " + id);
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Replay pending entries in FIFO order through the given client.
     * <p>
     * A delivered entry is removed. A 4xx answer marks the entry failed and the pass moves on.
     * A transport failure, 5xx or 401/403 stops the pass and leaves the rest queued. An entry whose
     * replay has drawn a server error {@code maxAttempts} times is marked failed instead, so it
     * cannot hold back the entries behind it.
     * Concurrent calls do not overlap: a call made while a pass runs returns a skipped result.
     */
    public ReplayResult replay(OkHttpClient client) {
        Objects.requireNonNull(client, "client must not be null");
        if (!replayLock.tryLock()) {
            LOG.fine("[Queue] Replay already running");
            return ReplayResult.skipped(pendingCount());
        }
        try {
            int delivered = 0;
            int failed = 0;
            MutationQueueEntry next;
            while ((next = nextPending()) != null) {
                Delivery delivery = deliver(client, next);
                if (delivery.outcome == Outcome.DELIVERED) {
                    complete(next);
                    delivered++;
                } else if (delivery.outcome == Outcome.REJECTED) {
                    reject(next, delivery.detail);
                    failed++;
                } else if (delivery.stopReason == ReplayResult.StopReason.SERVER
                        && next.getAttempts() + 1 >= maxAttempts) {
                    reject(next, delivery.detail + ", giving up after " + maxAttempts + " attempts");
                    failed++;
                } else {
                    recordAttempt(next, delivery.detail);
                    int remaining = pendingCount();
                    int deliveredCount = delivered;
                    LOG.info(() -> String.format("[Queue] Replay stopped (%s): %d delivered, %d remaining",
                            delivery.detail, deliveredCount, remaining));
                    return ReplayResult.stopped(delivered, failed, remaining, delivery.stopReason);
                }
            }
            if (delivered > 0 || failed > 0) {
                int deliveredCount = delivered;
                int failedCount = failed;
                LOG.info(() -> String.format("[Queue] Replay complete: %d delivered, %d failed", deliveredCount, failedCount));
            }
            return ReplayResult.completed(delivered, failed);
        } finally {
            replayLock.unlock();
        }
    }

    private Delivery deliver(OkHttpClient client, MutationQueueEntry entry) {
        Request request;
        try {
            request = toRequest(entry);
        } catch (IllegalArgumentException e) {
            return Delivery.rejected("unreplayable request: " + e.getMessage());
        }
        try (Response response = client.newCall(request).execute()) {
            int code = response.code();
            if (response.isSuccessful()) {
                return Delivery.delivered();
            }
            if (code == 401 || code == 403) {
                return Delivery.stopped(ReplayResult.StopReason.AUTH, "HTTP " + code);
            }
            if (code >= 500 || code == 408 || code == 429) {
                return Delivery.stopped(ReplayResult.StopReason.SERVER, "HTTP " + code);
            }
            return Delivery.rejected("HTTP " + code + " " + response.message());
        } catch (CredentialException e) {
            return Delivery.stopped(ReplayResult.StopReason.AUTH, e.getMessage());
        } catch (IOException e) {
            LOG.log(Level.FINE, "[Queue] Replay of " + entry.getId() + " failed", e);
            return Delivery.stopped(ReplayResult.StopReason.NETWORK, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static Request toRequest(MutationQueueEntry entry) {
        MediaType mediaType = entry.getContentType() == null ? null : MediaType.parse(entry.getContentType());
        byte[] bytes = entry.getBody() == null ? new byte[0] : entry.getBody().getBytes(StandardCharsets.UTF_8);
        Request.Builder builder = new Request.Builder()
                .url(entry.getUrl())
                .method(entry.getMethod(), RequestBody.create(bytes, mediaType));
        for (Map.Entry<String, String> header : entry.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.header(OfflineQueueInterceptor.IDEMPOTENCY_HEADER, entry.getId()).build();
    }

    private synchronized MutationQueueEntry nextPending() {
        for (MutationQueueEntry entry : entries) {
            if (entry.getStatus() == DeliveryStatus.PENDING) {
                return entry;
            }
        }
        return null;
    }

    private synchronized int pendingCount() {
        int count = 0;
        for (MutationQueueEntry entry : entries) {
            if (entry.getStatus() == DeliveryStatus.PENDING) {
                count++;
            }
        }
        return count;
    }

    private void complete(MutationQueueEntry entry) {
        MutationQueueEntry snapshot;
        synchronized (this) {
            entry.setAttempts(entry.getAttempts() + 1);
            entry.setStatus(DeliveryStatus.DELIVERED);
            entries.remove(entry);
            persistQuietly();
            snapshot = entry.copy();
        }
        LOG.info(() -> "[Queue] Delivered " + snapshot.getMethod() + " " + snapshot.getUrl());
        listeners.forEach(l -> l.onDelivered(snapshot));
    }

    private void reject(MutationQueueEntry entry, String detail) {
        MutationQueueEntry snapshot;
        synchronized (this) {
            entry.setAttempts(entry.getAttempts() + 1);
            entry.setStatus(DeliveryStatus.FAILED);
            entry.setLastError(detail);
            persistQuietly();
            snapshot = entry.copy();
        }
        LOG.warning(() -> "[Queue] Server refused replay of " + snapshot.getMethod() + " " + snapshot.getUrl() + ": " + detail);
        listeners.forEach(l -> l.onFailed(snapshot));
    }

    private synchronized void recordAttempt(MutationQueueEntry entry, String detail) {
        entry.setAttempts(entry.getAttempts() + 1);
        entry.setLastError(detail);
        persistQuietly();
    }

    private List<MutationQueueEntry> copyWithStatus(DeliveryStatus status) {
        List<MutationQueueEntry> res = new ArrayList<>();
        for (MutationQueueEntry entry : entries) {
            if (entry.getStatus() == status) {
                res.add(entry.copy());
            }
        }
        return res;
    }

    private void persist() throws IOException {
        store.save(new ArrayList<>(entries));
    }

    // A failed write after delivery only risks a duplicate replay, which the idempotency key absorbs.
    private void persistQuietly() {
        try {
            persist();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[Queue] Failed to persist queue state", e);
        }
    }

    private static Map<String, String> stripCredentials(Map<String, String> headers) {
        Map<String, String> res = new LinkedHashMap<>();
        if (headers == null) {
            return res;
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (!"Authorization".equalsIgnoreCase(header.getKey())) {
                res.put(header.getKey(), header.getValue());
            }
        }
        return res;
    }

    private enum Outcome {
        DELIVERED,
        REJECTED,
        STOPPED
    }

    private static final class Delivery {
        private final Outcome outcome;
        private final ReplayResult.StopReason stopReason;
        private final String detail;

        private Delivery(Outcome outcome, ReplayResult.StopReason stopReason, String detail) {
            this.outcome = outcome;
            this.stopReason = stopReason;
            this.detail = detail;
        }

        static Delivery delivered() {
            return new Delivery(Outcome.DELIVERED, null, null);
        }

        static Delivery rejected(String detail) {
            return new Delivery(Outcome.REJECTED, null, detail);
        }

        static Delivery stopped(ReplayResult.StopReason reason, String detail) {
            return new Delivery(Outcome.STOPPED, reason, detail);
        }
    }
}

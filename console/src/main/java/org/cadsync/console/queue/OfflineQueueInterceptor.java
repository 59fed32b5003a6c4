package org.cadsync.console.queue;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okio.Buffer;
import org.cadsync.console.api.CredentialException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Outermost interceptor of the API client.
 * <p>
 * Every mutating request gets an Idempotency-Key. When it fails without a response, or the server
 * answers 5xx, the request is written to the {@link MutationQueue} and the caller receives a
 * {@link QueuedMutationException}. While older entries are still pending, new mutations are queued
 * behind them without being sent so replay keeps creation order. A {@link CredentialException}
 * passes through untouched: the request never left the client, so it is neither queued nor taken as
 * a sign that the service is unreachable.
 */
public final class OfflineQueueInterceptor implements Interceptor {

    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private static final Logger LOG = Logger.getLogger(OfflineQueueInterceptor.class.getName());

    private final MutationQueue queue;
    private final ConnectivityMonitor connectivity;

    public OfflineQueueInterceptor(MutationQueue queue, ConnectivityMonitor connectivity) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.connectivity = Objects.requireNonNull(connectivity, "connectivity must not be null");
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        if (!isMutation(request.method())) {
            return proceedTracked(chain, request);
        }

        String mutationId = request.header(IDEMPOTENCY_HEADER);
        if (mutationId == null || mutationId.isEmpty()) {
            mutationId = UUID.randomUUID().toString();
            request = request.newBuilder().header(IDEMPOTENCY_HEADER, mutationId).build();
        }
        String description = request.method() + " " + request.url().encodedPath();

        if (queue.hasPending()) {
            MutationQueueEntry entry = enqueue(request, mutationId, null);
            throw new QueuedMutationException(entry.getId(),
                    description + " queued behind earlier undelivered mutations", null);
        }

        Response response;
        try {
            response = chain.proceed(request);
        } catch (CredentialException e) {
            throw e;
        } catch (IOException e) {
            connectivity.reportUnreachable(e);
            MutationQueueEntry entry = enqueue(request, mutationId, e);
            throw new QueuedMutationException(entry.getId(), description + " failed, queued for replay", e);
        }
        connectivity.reportReachable();

        if (response.code() >= 500) {
            int code = response.code();
            response.close();
            MutationQueueEntry entry = enqueue(request, mutationId, null);
            throw new QueuedMutationException(entry.getId(),
                    description + " answered HTTP " + code + ", queued for replay", null);
        }
        return response;
    }

    private Response proceedTracked(Chain chain, Request request) throws IOException {
        try {
            Response response = chain.proceed(request);
            connectivity.reportReachable();
            return response;
        } catch (CredentialException e) {
            throw e;
        } catch (IOException e) {
            connectivity.reportUnreachable(e);
            throw e;
        }
    }

    private MutationQueueEntry enqueue(Request request, String mutationId, IOException failure) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : request.headers().names()) {
            headers.put(name, request.header(name));
        }
        String body = null;
        String contentType = null;
        RequestBody requestBody = request.body();
        if (requestBody != null) {
            Buffer buffer = new Buffer();
            requestBody.writeTo(buffer);
            body = buffer.readUtf8();
            MediaType mediaType = requestBody.contentType();
            contentType = mediaType == null ? null : mediaType.toString();
        }
        try {
            return queue.enqueue(mutationId, request.method(), request.url().toString(), headers, body, contentType);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "[Queue] Could not persist " + request.method() + " " + request.url(), e);
            if (failure != null) {
                e.addSuppressed(failure);
            }
            throw e;
        }
    }

    static boolean isMutation(String method) {
        String m = method.toUpperCase(Locale.ROOT);
        return !("GET".equals(m) || "HEAD".equals(m) || "OPTIONS".equals(m));
    }
}

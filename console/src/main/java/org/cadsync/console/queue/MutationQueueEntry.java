package org.cadsync.console.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A mutating request persisted for later replay.
 * The id doubles as the request's Idempotency-Key so the server can recognise a replayed duplicate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MutationQueueEntry {

    /**
     * FIFO order: enqueue sequence. It is monotonic across restarts, unlike the wall clock.
     */
    public static final Comparator<MutationQueueEntry> FIFO =
            Comparator.comparingLong(MutationQueueEntry::getSequence);

    @JsonProperty("id")
    private String id;

    @JsonProperty("sequence")
    private long sequence;

    @JsonProperty("method")
    private String method;

    @JsonProperty("url")
    private String url;

    @JsonProperty("headers")
    private Map<String, String> headers = new LinkedHashMap<>();

    @JsonProperty("body")
    private String body;

    @JsonProperty("content_type")
    private String contentType;

    @JsonProperty("created_at")
    private long createdAtMillis;

    @JsonProperty("status")
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @JsonProperty("attempts")
    private int attempts;

    @JsonProperty("last_error")
    private String lastError;

    public MutationQueueEntry() {
        // for Jackson
    }

    MutationQueueEntry(String id, long sequence, String method, String url, Map<String, String> headers,
                       String body, String contentType, long createdAtMillis) {
        this.id = id;
        this.sequence = sequence;
        this.method = method;
        this.url = url;
        this.headers = headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
        this.body = body;
        this.contentType = contentType;
        this.createdAtMillis = createdAtMillis;
    }

    MutationQueueEntry copy() {
        MutationQueueEntry copy = new MutationQueueEntry(id, sequence, method, url, headers, body, contentType, createdAtMillis);
        copy.status = status;
        copy.attempts = attempts;
        copy.lastError = lastError;
        return copy;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers == null ? new LinkedHashMap<>() : headers;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public long getCreatedAtMillis() {
        return createdAtMillis;
    }

    public void setCreatedAtMillis(long createdAtMillis) {
        this.createdAtMillis = createdAtMillis;
    }

    @JsonIgnore
    public Instant getCreatedAt() {
        return Instant.ofEpochMilli(createdAtMillis);
    }

    public DeliveryStatus getStatus() {
        return status;
    }

    public void setStatus(DeliveryStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    @Override
    public String toString() {
        return "MutationQueueEntry{" +
                "id='" + id + '\'' +
                ", " + method + " " + url +
                ", status=" + status +
                ", attempts=" + attempts +
                '}';
    }
}

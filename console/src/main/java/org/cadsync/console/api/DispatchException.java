package org.cadsync.console.api;

import java.util.Objects;

/**
 * Failure of a dispatch operation, classified by {@link ErrorKind}.
 */
public class DispatchException extends Exception {

    private static final long serialVersionUID = 1L;

    public static final int NO_STATUS = -1;

    private final ErrorKind kind;
    private final int statusCode;
    private final String queuedEntryId;

    public DispatchException(ErrorKind kind, String message) {
        this(kind, message, NO_STATUS, null, null);
    }

    public DispatchException(ErrorKind kind, String message, int statusCode, String queuedEntryId, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.statusCode = statusCode;
        this.queuedEntryId = queuedEntryId;
    }

    public static DispatchException validation(String message) {
        return new DispatchException(ErrorKind.VALIDATION, message);
    }

    public static DispatchException network(String message, Throwable cause) {
        return new DispatchException(ErrorKind.NETWORK, message, NO_STATUS, null, cause);
    }

    public static DispatchException auth(String message, Throwable cause) {
        return new DispatchException(ErrorKind.AUTH, message, NO_STATUS, null, cause);
    }

    public static DispatchException queued(String message, String entryId, Throwable cause) {
        return new DispatchException(ErrorKind.NETWORK, message, NO_STATUS, entryId, cause);
    }

    /**
     * Classify an unsuccessful HTTP status: 401/403 are AUTH, 5xx NETWORK, any other code VALIDATION.
     */
    public static DispatchException fromStatus(int statusCode, String message) {
        ErrorKind kind;
        if (statusCode == 401 || statusCode == 403) {
            kind = ErrorKind.AUTH;
        } else if (statusCode >= 500) {
            kind = ErrorKind.NETWORK;
        } else {
            kind = ErrorKind.VALIDATION;
        }
        return new DispatchException(kind, message, statusCode, null, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the HTTP status, or {@link #NO_STATUS} when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return id of the mutation queue entry holding this request, or {@code null} if nothing was queued
     */
    public String getQueuedEntryId() {
        return queuedEntryId;
    }

    public boolean isQueued() {
        return queuedEntryId != null;
    }
}

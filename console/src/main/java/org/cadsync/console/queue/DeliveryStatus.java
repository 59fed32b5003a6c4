package org.cadsync.console.queue;

/**
 * Delivery state of a queued mutation.
 */
public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    /**
     * The server refused the replayed request. Kept for the dispatcher to review, never replayed again.
     */
    FAILED
}

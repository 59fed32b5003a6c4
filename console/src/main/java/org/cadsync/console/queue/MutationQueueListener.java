package org.cadsync.console.queue;

/**
 * Observer of queue activity, e.g. for a pending-actions badge.
 */
public interface MutationQueueListener {

    default void onEnqueued(MutationQueueEntry entry) {
    }

    default void onDelivered(MutationQueueEntry entry) {
    }

    default void onFailed(MutationQueueEntry entry) {
    }
}

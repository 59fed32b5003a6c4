package org.cadsync.console.queue;

/**
 * Notified on online/offline transitions, never on repeated reports of the same state.
 */
public interface ConnectivityListener {

    default void onOffline() {
    }

    default void onOnline() {
    }
}

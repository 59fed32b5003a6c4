package org.cadsync.console.realtime;

import org.cadsync.console.domain.model.ChangeSignal;

/**
 * Receives realtime invalidations. Callbacks run on OkHttp's WebSocket thread and must not block.
 */
public interface InvalidationListener {

    void onInvalidation(ChangeSignal signal);

    default void onConnected() {
    }

    default void onDisconnected() {
    }
}

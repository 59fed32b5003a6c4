package org.cadsync.console.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * "Something on the board changed, re-fetch." Carries no state by contract.
 */
public final class ChangeSignal {

    /**
     * What produced the signal.
     */
    public enum Source {
        REMOTE_MESSAGE,
        RECONNECT,
        POLL,
        LOCAL_MUTATION,
        CONNECTIVITY_RESTORED,
        STARTUP
    }

    private final Source source;
    private final Instant receivedAt;

    public ChangeSignal(Source source, Instant receivedAt) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    }

    public static ChangeSignal now(Source source) {
        return new ChangeSignal(source, Instant.now());
    }

    public Source getSource() {
        return source;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    @Override
    public String toString() {
        return "ChangeSignal{" + source + " at " + receivedAt + '}';
    }
}

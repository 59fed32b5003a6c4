package org.cadsync.console.queue;

import java.io.IOException;

/**
 * Raised to the caller of a mutation that was not delivered and now waits in the queue.
 */
public class QueuedMutationException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String entryId;

    public QueuedMutationException(String entryId, String message, Throwable cause) {
        super(message, cause);
        this.entryId = entryId;
    }

    public String getEntryId() {
        return entryId;
    }
}

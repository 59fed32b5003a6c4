package org.cadsync.console.queue;

import java.io.IOException;
import java.util.List;

/**
 * Durable storage behind the mutation queue.
 */
public interface MutationQueueStore {

    /**
     * Load every persisted entry, or an empty list when nothing was stored yet.
     */
    List<MutationQueueEntry> load() throws IOException;

    /**
     * Replace the stored entries with the given list.
     */
    void save(List<MutationQueueEntry> entries) throws IOException;
}

package org.cadsync.console.store;

import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.DispatchSnapshot;

/**
 * Observer of the dispatch board. Callbacks run on the refreshing thread, in refresh order.
 */
public interface SnapshotListener {

    void onSnapshot(DispatchSnapshot snapshot);

    /**
     * The previous snapshot is still current; show it as stale.
     */
    default void onRefreshFailed(DispatchException error) {
    }
}

package org.cadsync.console.store;

import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.Call;
import org.cadsync.console.domain.model.DispatchSnapshot;
import org.cadsync.console.domain.model.Unit;

import java.util.Optional;

/**
 * Console-side cache of all calls and units.
 * <p>
 * {@link #refresh()} is the only way its content changes.
 */
public interface DispatchStateStore {

    /**
     * Re-fetch calls and units and replace the snapshot with both at once.
     * On failure the previous snapshot stays current.
     *
     * @return the new snapshot
     */
    DispatchSnapshot refresh() throws DispatchException;

    /**
     * The current snapshot; empty (version 0) until the first successful refresh.
     */
    DispatchSnapshot getSnapshot();

    Optional<Call> findCall(String callId);

    Optional<Unit> findUnit(String unitId);

    /**
     * Check if a refresh has succeeded at least once.
     */
    boolean isInitialized();

    void addListener(SnapshotListener listener);

    void removeListener(SnapshotListener listener);
}

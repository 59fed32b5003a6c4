package org.cadsync.console.store;

import org.cadsync.console.api.DispatchApiClient;
import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.Call;
import org.cadsync.console.domain.model.DispatchSnapshot;
import org.cadsync.console.domain.model.Unit;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe implementation of DispatchStateStore.
 * Readers see an immutable snapshot; refreshes are serialized so an older fetch never replaces a newer one.
 */
public final class DispatchStateStoreImpl implements DispatchStateStore {

    private static final Logger LOG = Logger.getLogger(DispatchStateStoreImpl.class.getName());

    private final DispatchApiClient apiClient;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();

    private volatile DispatchSnapshot snapshot = DispatchSnapshot.empty();

    public DispatchStateStoreImpl(DispatchApiClient apiClient) {
        this(apiClient, Clock.systemUTC());
    }

    public DispatchStateStoreImpl(DispatchApiClient apiClient, Clock clock) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public DispatchSnapshot refresh() throws DispatchException {
        refreshLock.lock();
        try {
            List<Call> calls;
            List<Unit> units;
            try {
                calls = apiClient.fetchCalls();
                units = apiClient.fetchUnits();
            } catch (DispatchException e) {
                LOG.warning(() -> "[Store] Refresh failed, keeping snapshot v" + snapshot.getVersion() + ": " + e.getMessage());
                for (SnapshotListener listener : listeners) {
                    notifyFailure(listener, e);
                }
                throw e;
            }

            DispatchSnapshot next = new DispatchSnapshot(calls, units, clock.instant(), snapshot.getVersion() + 1);
            logInconsistencies(next);
            this.snapshot = next;
            LOG.fine(() -> "[Store] Snapshot replaced: " + next);

            for (SnapshotListener listener : listeners) {
                notifySnapshot(listener, next);
            }
            return next;
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public DispatchSnapshot getSnapshot() {
        return snapshot;
    }

    @Override
    public Optional<Call> findCall(String callId) {
        return snapshot.findCall(callId);
    }

    @Override
    public Optional<Unit> findUnit(String unitId) {
        return snapshot.findUnit(unitId);
    }

    @Override
    public boolean isInitialized() {
        return snapshot.getVersion() > 0;
    }

    @Override
    public void addListener(SnapshotListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void removeListener(SnapshotListener listener) {
        listeners.remove(listener);
    }

    private static void logInconsistencies(DispatchSnapshot next) {
        for (Call call : next.getCalls()) {
            if (!call.isConsistent()) {
                LOG.warning(() -> "[Store] Server reported inconsistent call: " + call);
            }
        }
    }

    private static void notifySnapshot(SnapshotListener listener, DispatchSnapshot next) {
        try {
            listener.onSnapshot(next);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "[Store] Snapshot listener failed", e);
        }
    }

    private static void notifyFailure(SnapshotListener listener, DispatchException error) {
        try {
            listener.onRefreshFailed(error);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "[Store] Snapshot listener failed", e);
        }
    }
}

package org.cadsync.console.domain.service;

import org.cadsync.console.api.DispatchApiClient;
import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.ChangeSignal;
import org.cadsync.console.domain.model.DispatchSnapshot;
import org.cadsync.console.store.DispatchStateStore;
import org.cadsync.console.store.RefreshCoordinator;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Implementation of AssignmentService.
 */
public final class AssignmentServiceImpl implements AssignmentService {

    private static final Logger LOG = Logger.getLogger(AssignmentServiceImpl.class.getName());

    private final DispatchApiClient apiClient;
    private final DispatchStateStore store;
    private final RefreshCoordinator refreshes;
    private final long refreshTimeoutMillis;
    private final Set<String> assigning = ConcurrentHashMap.newKeySet();

    public AssignmentServiceImpl(DispatchApiClient apiClient, DispatchStateStore store,
                                 RefreshCoordinator refreshes, long refreshTimeoutMillis) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.refreshes = Objects.requireNonNull(refreshes, "refreshes must not be null");
        this.refreshTimeoutMillis = refreshTimeoutMillis;
    }

    @Override
    public void assign(String callId, String unitId, AssignmentSource source) throws DispatchException {
        Objects.requireNonNull(source, "source must not be null");
        validate(callId, unitId);

        LOG.info(() -> String.format("[Assign] %s -> call %s (%s)", unitId, callId, source));
        assigning.add(callId);
        try {
            apiClient.assignUnit(callId, unitId);
            LOG.info(() -> String.format("[Assign] Server accepted %s for call %s", unitId, callId));
        } catch (DispatchException e) {
            if (e.isQueued()) {
                LOG.warning(() -> String.format("[Assign] %s for call %s queued as %s", unitId, callId, e.getQueuedEntryId()));
            } else {
                LOG.warning(() -> String.format("[Assign] %s for call %s failed (%s): %s", unitId, callId, e.getKind(), e.getMessage()));
            }
            throw e;
        } finally {
            assigning.remove(callId);
            refreshes.refreshAndWait(ChangeSignal.now(ChangeSignal.Source.LOCAL_MUTATION), refreshTimeoutMillis);
        }
    }

    @Override
    public boolean isAssigning(String callId) {
        return callId != null && assigning.contains(callId);
    }

    private void validate(String callId, String unitId) throws DispatchException {
        if (isBlank(callId) || isBlank(unitId)) {
            throw DispatchException.validation("Call and unit must both be selected");
        }
        DispatchSnapshot snapshot = store.getSnapshot();
        if (!snapshot.findCall(callId).isPresent()) {
            throw DispatchException.validation("Unknown call: " + callId);
        }
        if (!snapshot.findUnit(unitId).isPresent()) {
            throw DispatchException.validation("Unknown unit: " + unitId);
        }
        if (!snapshot.isAssignable(unitId)) {
            throw DispatchException.validation("Unit " + unitId + " is not available");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}

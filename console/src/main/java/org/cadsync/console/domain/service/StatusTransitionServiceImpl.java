package org.cadsync.console.domain.service;

import org.cadsync.console.api.DispatchApiClient;
import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.domain.model.ChangeSignal;
import org.cadsync.console.domain.model.DispatchSnapshot;
import org.cadsync.console.store.DispatchStateStore;
import org.cadsync.console.store.RefreshCoordinator;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of StatusTransitionService.
 */
public final class StatusTransitionServiceImpl implements StatusTransitionService {

    private static final Logger LOG = Logger.getLogger(StatusTransitionServiceImpl.class.getName());

    private final DispatchApiClient apiClient;
    private final DispatchStateStore store;
    private final RefreshCoordinator refreshes;
    private final long refreshTimeoutMillis;

    public StatusTransitionServiceImpl(DispatchApiClient apiClient, DispatchStateStore store,
                                       RefreshCoordinator refreshes, long refreshTimeoutMillis) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.refreshes = Objects.requireNonNull(refreshes, "refreshes must not be null");
        this.refreshTimeoutMillis = refreshTimeoutMillis;
    }

    @Override
    public void transition(String callId, CallStatus target, String unitId) throws DispatchException {
        Objects.requireNonNull(target, "target must not be null");
        if (target == CallStatus.UNKNOWN) {
            throw DispatchException.validation("Unknown is not a status that can be requested");
        }
        DispatchSnapshot snapshot = store.getSnapshot();
        if (callId == null || !snapshot.findCall(callId).isPresent()) {
            throw DispatchException.validation("Unknown call: " + callId);
        }
        if (unitId != null && !snapshot.findUnit(unitId).isPresent()) {
            throw DispatchException.validation("Unknown unit: " + unitId);
        }

        LOG.info(() -> String.format("[Status] call %s -> %s (unit %s)", callId, target.getWireName(), unitId));
        try {
            apiClient.transitionStatus(callId, target, unitId);
        } catch (DispatchException e) {
            if (e.isQueued()) {
                LOG.warning(() -> String.format("[Status] %s for call %s queued as %s", target, callId, e.getQueuedEntryId()));
            } else {
                LOG.warning(() -> String.format("[Status] %s for call %s rejected (%s): %s", target, callId, e.getKind(), e.getMessage()));
            }
            throw e;
        } finally {
            refreshes.refreshAndWait(ChangeSignal.now(ChangeSignal.Source.LOCAL_MUTATION), refreshTimeoutMillis);
        }
    }
}

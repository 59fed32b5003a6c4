package org.cadsync.console.domain.service;

import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.CallStatus;

/**
 * Service for advancing a call through its lifecycle.
 * <p>
 * Each operation is one independent request. Legality of the transition is decided by the server;
 * {@link CallStatus#nextStates()} only guides what the UI offers.
 */
public interface StatusTransitionService {

    /**
     * Request a status change for a call.
     *
     * @param unitId acting unit, may be null
     */
    void transition(String callId, CallStatus target, String unitId) throws DispatchException;

    default void enroute(String callId, String unitId) throws DispatchException {
        transition(callId, CallStatus.ENROUTE, unitId);
    }

    default void onScene(String callId, String unitId) throws DispatchException {
        transition(callId, CallStatus.ON_SCENE, unitId);
    }

    default void transport(String callId, String unitId) throws DispatchException {
        transition(callId, CallStatus.TRANSPORT, unitId);
    }

    default void available(String callId, String unitId) throws DispatchException {
        transition(callId, CallStatus.AVAILABLE, unitId);
    }
}

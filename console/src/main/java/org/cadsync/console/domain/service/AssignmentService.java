package org.cadsync.console.domain.service;

import org.cadsync.console.api.DispatchException;

/**
 * Service for assigning units to calls.
 */
public interface AssignmentService {

    /**
     * Assign a unit to a call.
     * <p>
     * Both ids are checked against the current snapshot before anything is sent; the unit must be
     * available and free of any other active call. The call's status is never changed locally: the
     * store is refreshed once the request completes, whatever its outcome.
     *
     * @throws DispatchException VALIDATION for unknown or unassignable ids and server rejections,
     *                           NETWORK when the request was queued for replay, AUTH when the session is gone
     */
    void assign(String callId, String unitId, AssignmentSource source) throws DispatchException;

    /**
     * Check if an assignment request for this call is currently in flight.
     */
    boolean isAssigning(String callId);
}

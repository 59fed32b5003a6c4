package org.cadsync.console.api;

import org.cadsync.console.domain.model.AuditEvent;
import org.cadsync.console.domain.model.Call;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.domain.model.Unit;

import java.util.List;

/**
 * Client interface for the dispatch service endpoints the console uses.
 */
public interface DispatchApiClient {

    /**
     * Fetch every call on the board.
     * GET /api/cad/calls
     */
    List<Call> fetchCalls() throws DispatchException;

    /**
     * Fetch every unit.
     * GET /api/cad/units
     */
    List<Unit> fetchUnits() throws DispatchException;

    /**
     * Fetch the global audit event stream.
     * GET /api/events
     */
    List<AuditEvent> fetchAuditEvents() throws DispatchException;

    /**
     * Bind a unit to a call.
     * POST /api/cad/dispatch
     */
    void assignUnit(String callId, String unitId) throws DispatchException;

    /**
     * Move a call to a new status, optionally naming the acting unit.
     * POST /api/cad/calls/{callId}/status
     */
    void transitionStatus(String callId, CallStatus status, String unitId) throws DispatchException;
}

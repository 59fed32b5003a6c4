package org.cadsync.console.domain.service;

import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.AuditEvent;

import java.util.List;

/**
 * Reads the history of a single call from the global audit stream.
 */
public interface AuditTimelineReader {

    /**
     * Events targeting the call, newest first. A null call id yields an empty list without any request.
     */
    List<AuditEvent> timelineFor(String callId) throws DispatchException;
}

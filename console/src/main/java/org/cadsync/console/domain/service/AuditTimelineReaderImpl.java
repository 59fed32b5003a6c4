package org.cadsync.console.domain.service;

import org.cadsync.console.api.DispatchApiClient;
import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.AuditEvent;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Implementation of AuditTimelineReader. Filtering happens client-side.
 */
public final class AuditTimelineReaderImpl implements AuditTimelineReader {

    private static final Logger LOG = Logger.getLogger(AuditTimelineReaderImpl.class.getName());

    private static final Comparator<AuditEvent> NEWEST_FIRST = Comparator.comparing(
            AuditEvent::getTimestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final DispatchApiClient apiClient;

    public AuditTimelineReaderImpl(DispatchApiClient apiClient) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient must not be null");
    }

    @Override
    public List<AuditEvent> timelineFor(String callId) throws DispatchException {
        if (callId == null) {
            return Collections.emptyList();
        }
        List<AuditEvent> events = apiClient.fetchAuditEvents();
        List<AuditEvent> timeline = events.stream()
                .filter(e -> isCallEvent(e) && callId.equals(e.getEntityId()))
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
        LOG.fine(() -> String.format("[Timeline] %d of %d events for call %s", timeline.size(), events.size(), callId));
        return timeline;
    }

    static boolean isCallEvent(AuditEvent event) {
        String type = event.getEntityType();
        return "call".equalsIgnoreCase(type) || "cad_call".equalsIgnoreCase(type);
    }
}

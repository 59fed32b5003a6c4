package org.cadsync.console.api;

import org.cadsync.console.api.dto.AuditEventDto;
import org.cadsync.console.api.dto.CallDto;
import org.cadsync.console.api.dto.UnitDto;
import org.cadsync.console.domain.model.AuditEvent;
import org.cadsync.console.domain.model.Call;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.domain.model.GeoPoint;
import org.cadsync.console.domain.model.Priority;
import org.cadsync.console.domain.model.Unit;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Converts wire DTOs into domain objects. Entries without an id are skipped and logged.
 */
final class DtoMapper {

    private static final Logger LOG = Logger.getLogger(DtoMapper.class.getName());
    private static final Pattern OFFSET_SUFFIX = Pattern.compile(".*T.*(Z|[+-]\\d{2}:?\\d{2})$");

    private DtoMapper() {
    }

    static List<Call> toCalls(List<CallDto> dtos) {
        List<Call> res = new ArrayList<>();
        if (dtos == null) {
            return res;
        }
        for (CallDto dto : dtos) {
            Call call = toCall(dto);
            if (call != null) {
                res.add(call);
            }
        }
        return res;
    }

    static Call toCall(CallDto dto) {
        if (dto == null || dto.getId() == null) {
            LOG.warning("[API] Skipping call without id");
            return null;
        }
        CallStatus status = CallStatus.fromWire(dto.getStatus());
        if (status == null) {
            LOG.warning(() -> "[API] Call " + dto.getId() + " has unrecognised status: " + dto.getStatus());
            status = CallStatus.UNKNOWN;
        }
        return Call.builder()
                .id(dto.getId())
                .callerName(dto.getCallerName())
                .callerPhone(dto.getCallerPhone())
                .address(dto.getLocationAddress())
                .location(GeoPoint.ofNullable(dto.getLatitude(), dto.getLongitude()))
                .priority(Priority.fromWire(dto.getPriority()))
                .status(status)
                .statusText(dto.getStatus())
                .etaMinutes(dto.getEtaMinutes())
                .assignedUnitIds(dto.getAssignedUnits())
                .createdAt(parseInstant(dto.getCreatedAt()))
                .build();
    }

    static List<Unit> toUnits(List<UnitDto> dtos) {
        List<Unit> res = new ArrayList<>();
        if (dtos == null) {
            return res;
        }
        for (UnitDto dto : dtos) {
            if (dto == null || dto.getUnitIdentifier() == null) {
                LOG.warning("[API] Skipping unit without identifier");
                continue;
            }
            res.add(Unit.builder()
                    .id(dto.getUnitIdentifier())
                    .statusText(dto.getStatus())
                    .unitType(dto.getUnitType())
                    .position(GeoPoint.ofNullable(dto.getLatitude(), dto.getLongitude()))
                    .currentCallId(dto.getCurrentCallId())
                    .build());
        }
        return res;
    }

    static List<AuditEvent> toAuditEvents(List<AuditEventDto> dtos) {
        List<AuditEvent> res = new ArrayList<>();
        if (dtos == null) {
            return res;
        }
        for (AuditEventDto dto : dtos) {
            if (dto == null || dto.getId() == null) {
                continue;
            }
            res.add(new AuditEvent(
                    dto.getId(),
                    dto.getAction(),
                    dto.getEntityType(),
                    dto.getEntityId(),
                    dto.getMetadata(),
                    parseInstant(dto.getTimestamp())
            ));
        }
        return res;
    }

    /**
     * Parse an ISO-8601 timestamp. Values without an offset are taken as UTC.
     *
     * @return the instant, or {@code null} when the value is blank or unparseable
     */
    static Instant parseInstant(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String text = value.trim();
        try {
            if (OFFSET_SUFFIX.matcher(text).matches()) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            LOG.fine(() -> "[API] Unparseable timestamp: " + text);
            return null;
        }
    }
}

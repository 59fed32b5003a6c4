package org.cadsync.console.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the collaborator-owned audit log. Read-only.
 */
public final class AuditEvent {

    private final String id;
    private final String action;
    private final String entityType;
    private final String entityId;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public AuditEvent(String id, String action, String entityType, String entityId,
                      Map<String, Object> metadata, Instant timestamp) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.action = action;
        this.entityType = entityType;
        this.entityId = entityId;
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.timestamp = timestamp;
    }

    public String getId() {
        return id;
    }

    public String getAction() {
        return action;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return when the action happened, or {@code null} if the log entry carried no parseable time
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "AuditEvent{" +
                "id='" + id + '\'' +
                ", action='" + action + '\'' +
                ", entity=" + entityType + "/" + entityId +
                ", timestamp=" + timestamp +
                '}';
    }
}

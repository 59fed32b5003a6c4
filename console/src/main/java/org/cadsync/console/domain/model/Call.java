package org.cadsync.console.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of a service request as last reported by the dispatch service.
 */
public final class Call {

    private final String id;
    private final String callerName;
    private final String callerPhone;
    private final String address;
    private final GeoPoint location;
    private final Priority priority;
    private final CallStatus status;
    private final String statusText;
    private final Integer etaMinutes;
    private final List<String> assignedUnitIds;
    private final Instant createdAt;

    private Call(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.callerName = builder.callerName;
        this.callerPhone = builder.callerPhone;
        this.address = builder.address;
        this.location = builder.location;
        this.priority = builder.priority == null ? Priority.ROUTINE : builder.priority;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.statusText = builder.statusText == null ? status.getWireName() : builder.statusText;
        this.etaMinutes = builder.etaMinutes;
        this.assignedUnitIds = Collections.unmodifiableList(new ArrayList<>(builder.assignedUnitIds));
        this.createdAt = builder.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getCallerName() {
        return callerName;
    }

    public String getCallerPhone() {
        return callerPhone;
    }

    public String getAddress() {
        return address;
    }

    /**
     * @return the position, or {@code null} when the intake did not geocode the call
     */
    public GeoPoint getLocation() {
        return location;
    }

    public Priority getPriority() {
        return priority;
    }

    public CallStatus getStatus() {
        return status;
    }

    /**
     * Status as the server spelled it; the only readable status of an {@link CallStatus#UNKNOWN} call.
     */
    public String getStatusText() {
        return statusText;
    }

    public Integer getEtaMinutes() {
        return etaMinutes;
    }

    public List<String> getAssignedUnitIds() {
        return assignedUnitIds;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isAssigned(String unitId) {
        return assignedUnitIds.contains(unitId);
    }

    /**
     * Checks the assignment invariant: no units once Available, at least one from Enroute to Transport.
     */
    public boolean isConsistent() {
        if (status == CallStatus.AVAILABLE) {
            return assignedUnitIds.isEmpty();
        }
        if (status.requiresAssignedUnit()) {
            return !assignedUnitIds.isEmpty();
        }
        return true;
    }

    @Override
    public String toString() {
        return "Call{" +
                "id='" + id + '\'' +
                ", status=" + statusText +
                ", priority=" + priority +
                ", assignedUnitIds=" + assignedUnitIds +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Call.
     */
    public static final class Builder {
        private String id;
        private String callerName;
        private String callerPhone;
        private String address;
        private GeoPoint location;
        private Priority priority;
        private CallStatus status;
        private String statusText;
        private Integer etaMinutes;
        private List<String> assignedUnitIds = new ArrayList<>();
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder callerName(String callerName) {
            this.callerName = callerName;
            return this;
        }

        public Builder callerPhone(String callerPhone) {
            this.callerPhone = callerPhone;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(CallStatus status) {
            this.status = status;
            return this;
        }

        public Builder statusText(String statusText) {
            this.statusText = statusText;
            return this;
        }

        public Builder etaMinutes(Integer etaMinutes) {
            this.etaMinutes = etaMinutes;
            return this;
        }

        public Builder assignedUnitIds(List<String> assignedUnitIds) {
            this.assignedUnitIds = assignedUnitIds == null ? new ArrayList<>() : new ArrayList<>(assignedUnitIds);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Call build() {
            return new Call(this);
        }
    }
}

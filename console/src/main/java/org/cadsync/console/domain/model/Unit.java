package org.cadsync.console.domain.model;

import java.util.Objects;

/**
 * Immutable view of a responder unit.
 */
public final class Unit {

    private final String id;
    private final UnitStatus status;
    private final String statusText;
    private final String unitType;
    private final GeoPoint position;
    private final String currentCallId;

    private Unit(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.statusText = builder.statusText;
        this.status = builder.status != null ? builder.status : UnitStatus.fromWire(builder.statusText);
        this.unitType = builder.unitType;
        this.position = builder.position;
        this.currentCallId = builder.currentCallId;
    }

    /**
     * Call-sign, unique across the fleet.
     */
    public String getId() {
        return id;
    }

    public UnitStatus getStatus() {
        return status;
    }

    /**
     * Status exactly as the server reported it, for display.
     */
    public String getStatusText() {
        return statusText;
    }

    public String getUnitType() {
        return unitType;
    }

    public GeoPoint getPosition() {
        return position;
    }

    /**
     * @return the call the server reports this unit committed to, or {@code null}
     */
    public String getCurrentCallId() {
        return currentCallId;
    }

    public boolean isAvailable() {
        return status == UnitStatus.AVAILABLE;
    }

    @Override
    public String toString() {
        return "Unit{" +
                "id='" + id + '\'' +
                ", status=" + status +
                ", currentCallId='" + currentCallId + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Unit.
     */
    public static final class Builder {
        private String id;
        private UnitStatus status;
        private String statusText;
        private String unitType;
        private GeoPoint position;
        private String currentCallId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(UnitStatus status) {
            this.status = status;
            return this;
        }

        public Builder statusText(String statusText) {
            this.statusText = statusText;
            return this;
        }

        public Builder unitType(String unitType) {
            this.unitType = unitType;
            return this;
        }

        public Builder position(GeoPoint position) {
            this.position = position;
            return this;
        }

        public Builder currentCallId(String currentCallId) {
            this.currentCallId = currentCallId;
            return this;
        }

        public Unit build() {
            return new Unit(this);
        }
    }
}

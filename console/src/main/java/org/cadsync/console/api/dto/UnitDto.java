package org.cadsync.console.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a unit in GET /api/cad/units.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UnitDto {

    @JsonProperty("unit_identifier")
    private String unitIdentifier;

    @JsonProperty("unit_type")
    private String unitType;

    @JsonProperty("status")
    private String status;

    @JsonProperty("latitude")
    private Double latitude;

    @JsonProperty("longitude")
    private Double longitude;

    @JsonProperty("current_call_id")
    private String currentCallId;

    public String getUnitIdentifier() {
        return unitIdentifier;
    }

    public void setUnitIdentifier(String unitIdentifier) {
        this.unitIdentifier = unitIdentifier;
    }

    public String getUnitType() {
        return unitType;
    }

    public void setUnitType(String unitType) {
        this.unitType = unitType;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public String getCurrentCallId() {
        return currentCallId;
    }

    public void setCurrentCallId(String currentCallId) {
        this.currentCallId = currentCallId;
    }
}

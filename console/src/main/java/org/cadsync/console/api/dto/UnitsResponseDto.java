package org.cadsync.console.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for GET /api/cad/units.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UnitsResponseDto {

    @JsonProperty("active_units")
    private List<UnitDto> activeUnits;

    public List<UnitDto> getActiveUnits() {
        return activeUnits;
    }

    public void setActiveUnits(List<UnitDto> activeUnits) {
        this.activeUnits = activeUnits;
    }
}

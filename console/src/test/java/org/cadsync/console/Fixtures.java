package org.cadsync.console;

import org.cadsync.console.domain.model.Call;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.domain.model.DispatchSnapshot;
import org.cadsync.console.domain.model.GeoPoint;
import org.cadsync.console.domain.model.Priority;
import org.cadsync.console.domain.model.Unit;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Domain objects for tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Call call(String id, CallStatus status, String... unitIds) {
        return Call.builder()
                .id(id)
                .address("1 Main St")
                .location(new GeoPoint(40.0, -75.0))
                .priority(Priority.HIGH)
                .status(status)
                .assignedUnitIds(Arrays.asList(unitIds))
                .build();
    }

    public static Unit unit(String id, String statusText) {
        return Unit.builder()
                .id(id)
                .statusText(statusText)
                .unitType("ALS")
                .position(new GeoPoint(40.01, -75.01))
                .build();
    }

    public static DispatchSnapshot snapshot(List<Call> calls, List<Unit> units) {
        return new DispatchSnapshot(calls, units, Instant.parse("2024-05-01T10:00:00Z"), 1L);
    }
}

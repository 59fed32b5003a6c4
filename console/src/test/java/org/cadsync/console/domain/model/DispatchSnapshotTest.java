package org.cadsync.console.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.cadsync.console.Fixtures.call;
import static org.cadsync.console.Fixtures.snapshot;
import static org.cadsync.console.Fixtures.unit;

final class DispatchSnapshotTest {

    @Test
    void emptySnapshotHasVersionZero() {
        DispatchSnapshot empty = DispatchSnapshot.empty();

        assertThat(empty.getVersion()).isZero();
        assertThat(empty.getCalls()).isEmpty();
        assertThat(empty.findCall("C1")).isEmpty();
    }

    @Test
    void availableUnitWithoutActiveCallIsAssignable() {
        DispatchSnapshot snapshot = snapshot(
                Collections.singletonList(call("C1", CallStatus.DISPATCHED)),
                Collections.singletonList(unit("U1", "Available")));

        assertThat(snapshot.isAssignable("U1")).isTrue();
        assertThat(snapshot.isAssignable("U9")).isFalse();
    }

    @Test
    void unitBoundToActiveCallIsNotAssignable() {
        DispatchSnapshot snapshot = snapshot(
                Collections.singletonList(call("C1", CallStatus.ON_SCENE, "U1")),
                Collections.singletonList(unit("U1", "Available")));

        assertThat(snapshot.isAssignable("U1")).isFalse();
        assertThat(snapshot.activeCallFor("U1")).map(Call::getId).contains("C1");
    }

    @Test
    void closedCallsDoNotHoldUnits() {
        DispatchSnapshot snapshot = snapshot(
                Collections.singletonList(call("C1", CallStatus.CLOSED, "U1")),
                Collections.singletonList(unit("U1", "Available")));

        assertThat(snapshot.activeCallFor("U1")).isEmpty();
        assertThat(snapshot.isAssignable("U1")).isTrue();
    }

    @Test
    void committedUnitIsNotAssignable() {
        DispatchSnapshot snapshot = snapshot(
                Collections.emptyList(),
                Arrays.asList(unit("U1", "En Route"), unit("U2", "out_of_service")));

        assertThat(snapshot.findUnit("U1").map(Unit::getStatus)).contains(UnitStatus.COMMITTED);
        assertThat(snapshot.findUnit("U2").map(Unit::getStatus)).contains(UnitStatus.OUT_OF_SERVICE);
        assertThat(snapshot.isAssignable("U1")).isFalse();
        assertThat(snapshot.isAssignable("U2")).isFalse();
    }

    @Test
    void consistencyFollowsAssignmentRules() {
        assertThat(call("C1", CallStatus.ENROUTE).isConsistent()).isFalse();
        assertThat(call("C1", CallStatus.ENROUTE, "U1").isConsistent()).isTrue();
        assertThat(call("C1", CallStatus.AVAILABLE, "U1").isConsistent()).isFalse();
        assertThat(call("C1", CallStatus.DISPATCHED).isConsistent()).isTrue();
    }

    @Test
    void priorityParsingIsLenient() {
        assertThat(Priority.fromWire("Emergency")).isEqualTo(Priority.CRITICAL);
        assertThat(Priority.fromWire("urgent")).isEqualTo(Priority.HIGH);
        assertThat(Priority.fromWire("low")).isEqualTo(Priority.ROUTINE);
        assertThat(Priority.fromWire(null)).isEqualTo(Priority.ROUTINE);
        assertThat(Priority.ROUTINE.isUrgent()).isFalse();
    }

    @Test
    void geoPointRejectsOutOfRangeCoordinates() {
        assertThat(GeoPoint.ofNullable(91.0, 0.0)).isNull();
        assertThat(GeoPoint.ofNullable(null, 10.0)).isNull();
        assertThat(GeoPoint.ofNullable(45.0, 10.0)).isEqualTo(new GeoPoint(45.0, 10.0));
    }
}

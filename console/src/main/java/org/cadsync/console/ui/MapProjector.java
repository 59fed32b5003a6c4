package org.cadsync.console.ui;

import org.cadsync.console.domain.model.Call;
import org.cadsync.console.domain.model.DispatchSnapshot;
import org.cadsync.console.domain.model.Unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a snapshot into map markers. Entities without a position are left off the map.
 */
public final class MapProjector {

    public List<MapMarker> project(DispatchSnapshot snapshot, SelectionModel selection) {
        return project(snapshot, selection.getSelectedCallId(), selection.getSelectedUnitId());
    }

    public List<MapMarker> project(DispatchSnapshot snapshot, String selectedCallId, String selectedUnitId) {
        Set<String> highlightedCalls = new HashSet<>();
        Set<String> highlightedUnits = new HashSet<>();

        if (selectedCallId != null) {
            snapshot.findCall(selectedCallId).ifPresent(call -> {
                highlightedCalls.add(call.getId());
                highlightedUnits.addAll(call.getAssignedUnitIds());
            });
        }
        if (selectedUnitId != null && snapshot.findUnit(selectedUnitId).isPresent()) {
            highlightedUnits.add(selectedUnitId);
            boundCall(snapshot, selectedUnitId).ifPresent(highlightedCalls::add);
        }

        List<MapMarker> markers = new ArrayList<>();
        for (Call call : snapshot.getCalls()) {
            if (call.getLocation() == null) {
                continue;
            }
            markers.add(new MapMarker(MapMarker.Kind.CALL, call.getId(), call.getLocation(),
                    call.getAddress() != null ? call.getAddress() : call.getId(),
                    call.getStatusText(), call.getPriority(),
                    highlightedCalls.contains(call.getId())));
        }
        for (Unit unit : snapshot.getUnits()) {
            if (unit.getPosition() == null) {
                continue;
            }
            markers.add(new MapMarker(MapMarker.Kind.UNIT, unit.getId(), unit.getPosition(),
                    unit.getId(), unit.getStatusText(), null,
                    highlightedUnits.contains(unit.getId())));
        }
        return Collections.unmodifiableList(markers);
    }

    private static Optional<String> boundCall(DispatchSnapshot snapshot, String unitId) {
        Optional<Call> active = snapshot.activeCallFor(unitId);
        if (active.isPresent()) {
            return Optional.of(active.get().getId());
        }
        return snapshot.findUnit(unitId).map(Unit::getCurrentCallId);
    }
}

package org.cadsync.console.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The calls and units of one successful fetch, held together so they are never
 * rendered against a different fetch of the other collection.
 */
public final class DispatchSnapshot {

    private static final DispatchSnapshot EMPTY =
            new DispatchSnapshot(Collections.emptyList(), Collections.emptyList(), Instant.EPOCH, 0L);

    private final List<Call> calls;
    private final List<Unit> units;
    private final Map<String, Call> callsById;
    private final Map<String, Unit> unitsById;
    private final Instant fetchedAt;
    private final long version;

    public DispatchSnapshot(List<Call> calls, List<Unit> units, Instant fetchedAt, long version) {
        Objects.requireNonNull(calls, "calls must not be null");
        Objects.requireNonNull(units, "units must not be null");
        this.calls = Collections.unmodifiableList(new ArrayList<>(calls));
        this.units = Collections.unmodifiableList(new ArrayList<>(units));
        this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
        this.version = version;

        Map<String, Call> callIndex = new LinkedHashMap<>();
        for (Call call : this.calls) {
            callIndex.put(call.getId(), call);
        }
        Map<String, Unit> unitIndex = new LinkedHashMap<>();
        for (Unit unit : this.units) {
            unitIndex.put(unit.getId(), unit);
        }
        this.callsById = Collections.unmodifiableMap(callIndex);
        this.unitsById = Collections.unmodifiableMap(unitIndex);
    }

    public static DispatchSnapshot empty() {
        return EMPTY;
    }

    /**
     * Calls in the order the server returned them.
     */
    public List<Call> getCalls() {
        return calls;
    }

    public List<Unit> getUnits() {
        return units;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    /**
     * Increases by one on every successful refresh. 0 means nothing was fetched yet.
     */
    public long getVersion() {
        return version;
    }

    public Optional<Call> findCall(String callId) {
        return Optional.ofNullable(callId == null ? null : callsById.get(callId));
    }

    public Optional<Unit> findUnit(String unitId) {
        return Optional.ofNullable(unitId == null ? null : unitsById.get(unitId));
    }

    /**
     * The active call a unit is bound to, if any.
     */
    public Optional<Call> activeCallFor(String unitId) {
        for (Call call : calls) {
            if (call.getStatus().isActive() && call.isAssigned(unitId)) {
                return Optional.of(call);
            }
        }
        return Optional.empty();
    }

    /**
     * A unit can take a new call when the server reports it available and no active call holds it.
     */
    public boolean isAssignable(String unitId) {
        Optional<Unit> unit = findUnit(unitId);
        return unit.isPresent() && unit.get().isAvailable() && !activeCallFor(unitId).isPresent();
    }

    @Override
    public String toString() {
        return "DispatchSnapshot{" +
                "version=" + version +
                ", calls=" + calls.size() +
                ", units=" + units.size() +
                ", fetchedAt=" + fetchedAt +
                '}';
    }
}

package org.cadsync.console.ui;

import org.cadsync.console.api.DispatchException;
import org.cadsync.console.domain.model.Call;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.domain.service.StatusTransitionService;
import org.cadsync.console.store.DispatchStateStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Digit-key shortcuts for status transitions on the selected call.
 * <p>
 * Defaults: 1 Enroute, 2 OnScene, 3 Transport, 4 Available. A key press without a selected call, or
 * on an unbound key, does nothing.
 */
public final class TransitionShortcuts {

    private static final Logger LOG = Logger.getLogger(TransitionShortcuts.class.getName());

    /**
     * A resolved shortcut: which call, which status, which acting unit (may be null).
     */
    public static final class Action {
        private final String callId;
        private final CallStatus target;
        private final String unitId;

        Action(String callId, CallStatus target, String unitId) {
            this.callId = callId;
            this.target = target;
            this.unitId = unitId;
        }

        public String getCallId() {
            return callId;
        }

        public CallStatus getTarget() {
            return target;
        }

        public String getUnitId() {
            return unitId;
        }

        @Override
        public String toString() {
            return "Action{" + callId + " -> " + target + ", unit=" + unitId + '}';
        }
    }

    private final SelectionModel selection;
    private final DispatchStateStore store;
    private final StatusTransitionService transitions;
    private final Map<Character, CallStatus> bindings = new LinkedHashMap<>();

    public TransitionShortcuts(SelectionModel selection, DispatchStateStore store, StatusTransitionService transitions) {
        this.selection = Objects.requireNonNull(selection, "selection must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.transitions = Objects.requireNonNull(transitions, "transitions must not be null");
        bindings.put('1', CallStatus.ENROUTE);
        bindings.put('2', CallStatus.ON_SCENE);
        bindings.put('3', CallStatus.TRANSPORT);
        bindings.put('4', CallStatus.AVAILABLE);
    }

    public synchronized void bind(char key, CallStatus target) {
        bindings.put(key, Objects.requireNonNull(target, "target must not be null"));
    }

    public synchronized void unbind(char key) {
        bindings.remove(key);
    }

    public synchronized Map<Character, CallStatus> getBindings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    /**
     * Work out what a key press would do, without sending anything.
     */
    public Optional<Action> resolve(char key) {
        CallStatus target;
        synchronized (this) {
            target = bindings.get(key);
        }
        if (target == null) {
            return Optional.empty();
        }
        String callId = selection.getSelectedCallId();
        if (callId == null) {
            LOG.fine(() -> "Shortcut " + key + " ignored: no call selected");
            return Optional.empty();
        }
        Optional<Call> call = store.findCall(callId);
        if (!call.isPresent()) {
            LOG.fine(() -> "Shortcut " + key + " ignored: call " + callId + " no longer on the board");
            return Optional.empty();
        }
        return Optional.of(new Action(callId, target, actingUnit(call.get())));
    }

    /**
     * Handle a key press synchronously.
     *
     * @return true if a transition request was made
     */
    public boolean handleKey(char key) throws DispatchException {
        Optional<Action> action = resolve(key);
        if (!action.isPresent()) {
            return false;
        }
        Action a = action.get();
        transitions.transition(a.getCallId(), a.getTarget(), a.getUnitId());
        return true;
    }

    private String actingUnit(Call call) {
        String selectedUnit = selection.getSelectedUnitId();
        if (selectedUnit != null && call.isAssigned(selectedUnit)) {
            return selectedUnit;
        }
        return call.getAssignedUnitIds().isEmpty() ? null : call.getAssignedUnitIds().get(0);
    }
}

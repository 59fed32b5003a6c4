package org.cadsync.console.ui;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The call and unit the dispatcher currently has selected. Either may be null.
 */
public final class SelectionModel {

    private static final Logger LOG = Logger.getLogger(SelectionModel.class.getName());

    /**
     * Observer of selection changes.
     */
    public interface Listener {
        void onSelectionChanged(String callId, String unitId);
    }

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private String selectedCallId;
    private String selectedUnitId;

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    public void selectCall(String callId) {
        String unitId;
        synchronized (this) {
            if (Objects.equals(selectedCallId, callId)) {
                return;
            }
            selectedCallId = callId;
            unitId = selectedUnitId;
        }
        fire(callId, unitId);
    }

    public void selectUnit(String unitId) {
        String callId;
        synchronized (this) {
            if (Objects.equals(selectedUnitId, unitId)) {
                return;
            }
            selectedUnitId = unitId;
            callId = selectedCallId;
        }
        fire(callId, unitId);
    }

    public void clear() {
        synchronized (this) {
            if (selectedCallId == null && selectedUnitId == null) {
                return;
            }
            selectedCallId = null;
            selectedUnitId = null;
        }
        fire(null, null);
    }

    public synchronized String getSelectedCallId() {
        return selectedCallId;
    }

    public synchronized String getSelectedUnitId() {
        return selectedUnitId;
    }

    private void fire(String callId, String unitId) {
        for (Listener listener : listeners) {
            try {
                listener.onSelectionChanged(callId, unitId);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Selection listener failed", e);
            }
        }
    }
}

package org.cadsync.console.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a call: Dispatched, Enroute, OnScene, Transport, then Available or Closed.
 * {@link #UNKNOWN} stands for a server status this console does not recognise; such a call stays on
 * the board but offers no transitions.
 * <p>
 * The successor sets only drive which transitions a console offers. The dispatch service decides
 * whether a requested transition is legal.
 */
public enum CallStatus {
    DISPATCHED("Dispatched"),
    ENROUTE("Enroute"),
    ON_SCENE("OnScene"),
    TRANSPORT("Transport"),
    AVAILABLE("Available"),
    CLOSED("Closed"),
    UNKNOWN("Unknown");

    private final String wireName;

    CallStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * States a dispatcher may pick next from this one.
     */
    public Set<CallStatus> nextStates() {
        switch (this) {
            case DISPATCHED:
                return Collections.unmodifiableSet(EnumSet.of(ENROUTE));
            case ENROUTE:
                return Collections.unmodifiableSet(EnumSet.of(ON_SCENE));
            case ON_SCENE:
                return Collections.unmodifiableSet(EnumSet.of(TRANSPORT));
            case TRANSPORT:
                return Collections.unmodifiableSet(EnumSet.of(AVAILABLE, CLOSED));
            default:
                return Collections.emptySet();
        }
    }

    /**
     * True from Enroute through Transport: at least one unit must be bound.
     */
    public boolean requiresAssignedUnit() {
        return this == ENROUTE || this == ON_SCENE || this == TRANSPORT;
    }

    /**
     * True while the call still holds its units.
     */
    public boolean isActive() {
        return this != AVAILABLE && this != CLOSED;
    }

    /**
     * Parse the status text reported by the server.
     * Accepts the canonical names as well as the snake_case and spaced variants
     * ("en_route", "On Scene", "transporting").
     *
     * @return the status, or {@code null} for blank or unrecognised input
     */
    public static CallStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        String key = value.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "").replace("-", "");
        switch (key) {
            case "dispatched":
            case "assigned":
                return DISPATCHED;
            case "enroute":
            case "enroutetopickup":
                return ENROUTE;
            case "onscene":
                return ON_SCENE;
            case "transport":
            case "transporting":
                return TRANSPORT;
            case "available":
                return AVAILABLE;
            case "closed":
                return CLOSED;
            case "unknown":
                return UNKNOWN;
            default:
                return null;
        }
    }
}

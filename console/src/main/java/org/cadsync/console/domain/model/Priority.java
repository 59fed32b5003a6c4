package org.cadsync.console.domain.model;

import java.util.Locale;

/**
 * Call priority, ordered by urgency. Used for styling only, never for reordering the call queue.
 */
public enum Priority {
    ROUTINE("Routine"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isUrgent() {
        return this != ROUTINE;
    }

    /**
     * Parse a server priority. "Urgent"/"Medium" map to HIGH, "Emergency" to CRITICAL,
     * "Low" and anything unknown to ROUTINE.
     */
    public static Priority fromWire(String value) {
        if (value == null) {
            return ROUTINE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical":
            case "emergency":
                return CRITICAL;
            case "high":
            case "urgent":
            case "medium":
                return HIGH;
            default:
                return ROUTINE;
        }
    }
}

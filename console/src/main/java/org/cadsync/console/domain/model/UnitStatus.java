package org.cadsync.console.domain.model;

import java.util.Locale;

/**
 * Coarse unit availability derived from the server's unit status text.
 */
public enum UnitStatus {
    AVAILABLE,
    COMMITTED,
    OUT_OF_SERVICE;

    public static UnitStatus fromWire(String value) {
        if (value == null || value.trim().isEmpty()) {
            return OUT_OF_SERVICE;
        }
        String key = value.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        switch (key) {
            case "available":
            case "in quarters":
                return AVAILABLE;
            case "out of service":
            case "off duty":
            case "unavailable":
                return OUT_OF_SERVICE;
            default:
                return COMMITTED;
        }
    }
}

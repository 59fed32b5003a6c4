package org.cadsync.console.ui;

import org.cadsync.console.domain.model.GeoPoint;
import org.cadsync.console.domain.model.Priority;

import java.util.Objects;

/**
 * One pin on the map.
 */
public final class MapMarker {

    public enum Kind {
        CALL,
        UNIT
    }

    private final Kind kind;
    private final String id;
    private final GeoPoint position;
    private final String label;
    private final String statusText;
    private final Priority priority;
    private final boolean highlighted;

    MapMarker(Kind kind, String id, GeoPoint position, String label, String statusText,
              Priority priority, boolean highlighted) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.label = label;
        this.statusText = statusText;
        this.priority = priority;
        this.highlighted = highlighted;
    }

    public Kind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public GeoPoint getPosition() {
        return position;
    }

    public String getLabel() {
        return label;
    }

    public String getStatusText() {
        return statusText;
    }

    /**
     * Priority of a call marker; null for units.
     */
    public Priority getPriority() {
        return priority;
    }

    public boolean isUrgent() {
        return priority != null && priority.isUrgent();
    }

    public boolean isHighlighted() {
        return highlighted;
    }

    @Override
    public String toString() {
        return "MapMarker{" + kind + ' ' + id + " at " + position + (highlighted ? ", highlighted" : "") + '}';
    }
}

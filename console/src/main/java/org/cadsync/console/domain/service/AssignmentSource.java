package org.cadsync.console.domain.service;

/**
 * UI gesture that produced an assignment. Both gestures go through the same operation.
 */
public enum AssignmentSource {
    DRAG_AND_DROP,
    MANUAL_SELECTION
}

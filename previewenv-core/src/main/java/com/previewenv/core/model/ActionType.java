package com.previewenv.core.model;

/**
 * Lifecycle action kinds delivered by the event ingress and the sweeper.
 */
public enum ActionType {
    CREATE,
    UPDATE,
    DESTROY
}

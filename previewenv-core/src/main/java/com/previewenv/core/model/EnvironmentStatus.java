package com.previewenv.core.model;

/**
 * Lifecycle states for a preview environment.
 * Transitions follow a strict state machine, see {@link #canTransitionTo}.
 */
public enum EnvironmentStatus {
    /**
     * Record claimed, services being provisioned.
     * Transitions: -> ACTIVE, UPDATING, DESTROYING, FAILED
     */
    CREATING,

    /**
     * All services attempted, environment reachable.
     * Transitions: -> UPDATING, DESTROYING, FAILED
     */
    ACTIVE,

    /**
     * New commit being rolled out in place.
     * Transitions: -> ACTIVE, UPDATING, DESTROYING, FAILED
     */
    UPDATING,

    /**
     * Teardown in progress. Re-entrant.
     * Transitions: -> DESTROYING, DESTROYED, FAILED
     */
    DESTROYING,

    /**
     * All resources released. Terminal but reusable.
     * Transitions: -> CREATING, FAILED
     */
    DESTROYED,

    /**
     * Controller-level error. Terminal but reusable.
     * Transitions: -> CREATING, DESTROYING, FAILED
     */
    FAILED;

    /**
     * Environments in these states own backend resources and count against capacity.
     */
    public boolean isLive() {
        return this == CREATING || this == ACTIVE || this == UPDATING;
    }

    /**
     * A CREATE may start a fresh cycle over a record in one of these states.
     */
    public boolean isReusable() {
        return this == DESTROYED || this == FAILED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(EnvironmentStatus target) {
        if (target == FAILED) {
            return true;
        }
        return switch (this) {
            case CREATING -> target == ACTIVE || target == UPDATING || target == DESTROYING;
            case ACTIVE -> target == UPDATING || target == DESTROYING;
            case UPDATING -> target == ACTIVE || target == UPDATING || target == DESTROYING;
            case DESTROYING -> target == DESTROYING || target == DESTROYED;
            case DESTROYED -> target == CREATING;
            case FAILED -> target == CREATING || target == DESTROYING;
        };
    }
}

package com.previewenv.engine.controller;

import com.previewenv.core.model.ActionType;
import com.previewenv.core.model.EnvironmentStatus;

/**
 * Maps a requested action and the current record status to a plan.
 * This is the only place where duplicate, reordered and concurrent deliveries are reconciled.
 */
public final class ActionMerger {

    private ActionMerger() {
    }

    /**
     * @param requested the delivered action
     * @param current   status of the stored record, or null if none exists
     */
    public static ActionPlan resolve(ActionType requested, EnvironmentStatus current) {
        return switch (requested) {
            case CREATE, UPDATE -> resolveDeploy(current);
            case DESTROY -> resolveDestroy(current);
        };
    }

    private static ActionPlan resolveDeploy(EnvironmentStatus current) {
        if (current == null) {
            return ActionPlan.PROVISION;
        }
        return switch (current) {
            case DESTROYED, FAILED -> ActionPlan.PROVISION;
            case CREATING, ACTIVE, UPDATING -> ActionPlan.REFRESH;
            case DESTROYING -> ActionPlan.NOOP;
        };
    }

    private static ActionPlan resolveDestroy(EnvironmentStatus current) {
        if (current == null) {
            return ActionPlan.NOOP;
        }
        return switch (current) {
            case DESTROYED -> ActionPlan.NOOP;
            case CREATING, ACTIVE, UPDATING, DESTROYING, FAILED -> ActionPlan.TEARDOWN;
        };
    }
}

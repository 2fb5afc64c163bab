package com.previewenv.engine.service;

import com.previewenv.core.model.LifecycleAction;

/**
 * Single entry point for lifecycle actions, shared by the event path and the sweeper.
 */
public interface LifecycleActionHandler {

    /**
     * Converge the environment towards the requested action.
     * Safe to call again with the same action.
     *
     * @throws com.previewenv.core.exception.InvalidActionException if the action is malformed
     * @throws com.previewenv.core.exception.PreviewEnvException if the controller failed;
     *         the environment has been marked FAILED
     */
    void handle(LifecycleAction action);
}

package com.previewenv.engine.controller;

/**
 * What the controller does for a requested action given the current record.
 */
public enum ActionPlan {
    /** Write a fresh CREATING record and deploy every matching service */
    PROVISION,
    /** Redeploy in place, add missing services, refresh expiry */
    REFRESH,
    /** Reclaim every resource and mark DESTROYED */
    TEARDOWN,
    /** Nothing to do */
    NOOP
}

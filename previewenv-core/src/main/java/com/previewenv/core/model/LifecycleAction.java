package com.previewenv.core.model;

import com.previewenv.core.exception.InvalidActionException;

/**
 * A lifecycle action as delivered by the event ingress or issued by the sweeper.
 * Delivery is at-least-once, so the same action may arrive more than once.
 */
public record LifecycleAction(
    ActionType action,
    String environmentId,
    String repository,
    String branch,
    String commitRef,
    PrMetadata prMetadata,
    String reason
) {
    public static final String ENVIRONMENT_ID_PREFIX = "pr-";

    public static final String REASON_TTL_EXPIRED = "TTL_EXPIRED";
    public static final String REASON_STUCK_TRANSITION = "STUCK_TRANSITION";

    /**
     * Stable environment id for a pull request number.
     */
    public static String environmentIdFor(int pullRequestNumber) {
        return ENVIRONMENT_ID_PREFIX + pullRequestNumber;
    }

    /**
     * A DESTROY for an existing record, carrying the record's own source fields.
     */
    public static LifecycleAction destroy(Environment environment, String reason) {
        return new LifecycleAction(
            ActionType.DESTROY,
            environment.environmentId(),
            environment.repository(),
            environment.branch(),
            environment.commitRef(),
            environment.prMetadata(),
            reason
        );
    }

    /**
     * Reject actions the controller cannot act on.
     *
     * @throws InvalidActionException if a required field is missing
     */
    public LifecycleAction validate() {
        if (action == null) {
            throw new InvalidActionException("action is required");
        }
        if (environmentId == null || environmentId.isBlank()) {
            throw new InvalidActionException("environmentId is required");
        }
        if (action != ActionType.DESTROY) {
            if (repository == null || repository.isBlank()) {
                throw new InvalidActionException(action + " for " + environmentId + " requires a repository");
            }
            if (commitRef == null || commitRef.isBlank()) {
                throw new InvalidActionException(action + " for " + environmentId + " requires a commitRef");
            }
        }
        return this;
    }
}

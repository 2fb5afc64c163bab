package com.previewenv.core.model;

import com.previewenv.core.exception.InvalidActionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleActionTest {

    @Test
    void environmentIdFor_shouldPrefixPullRequestNumber() {
        assertEquals("pr-17", LifecycleAction.environmentIdFor(17));
    }

    @Test
    void validate_shouldAcceptCompleteCreate() {
        LifecycleAction action = new LifecycleAction(ActionType.CREATE, "pr-1", "org/api-gateway",
            "main", "deadbeef", PrMetadata.of(1, "https://example.com/pr/1"), null);

        assertSame(action, action.validate());
    }

    @Test
    void validate_shouldRejectMissingEnvironmentId() {
        LifecycleAction action = new LifecycleAction(ActionType.DESTROY, " ", null, null, null, null, null);

        InvalidActionException ex = assertThrows(InvalidActionException.class, action::validate);
        assertEquals(InvalidActionException.ERROR_CODE, ex.getErrorCode());
    }

    @Test
    void validate_shouldRequireRepositoryForCreateAndUpdate() {
        LifecycleAction update = new LifecycleAction(ActionType.UPDATE, "pr-1", null,
            "main", "deadbeef", null, null);

        assertThrows(InvalidActionException.class, update::validate);
    }

    @Test
    void validate_shouldAllowBareDestroy() {
        LifecycleAction destroy = new LifecycleAction(ActionType.DESTROY, "pr-1", null, null, null, null, null);

        assertDoesNotThrow(destroy::validate);
    }
}

package com.previewenv.engine.controller;

import com.previewenv.core.model.ActionType;
import com.previewenv.core.model.EnvironmentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class ActionMergerTest {

    @ParameterizedTest
    @EnumSource(value = ActionType.class, names = {"CREATE", "UPDATE"})
    @DisplayName("CREATE and UPDATE provision when there is nothing live")
    void deployActionsProvisionWhenNothingLive(ActionType action) {
        assertThat(ActionMerger.resolve(action, null)).isEqualTo(ActionPlan.PROVISION);
        assertThat(ActionMerger.resolve(action, EnvironmentStatus.DESTROYED)).isEqualTo(ActionPlan.PROVISION);
        assertThat(ActionMerger.resolve(action, EnvironmentStatus.FAILED)).isEqualTo(ActionPlan.PROVISION);
    }

    @ParameterizedTest
    @EnumSource(value = ActionType.class, names = {"CREATE", "UPDATE"})
    @DisplayName("CREATE and UPDATE refresh a live environment")
    void deployActionsRefreshLiveEnvironment(ActionType action) {
        assertThat(ActionMerger.resolve(action, EnvironmentStatus.CREATING)).isEqualTo(ActionPlan.REFRESH);
        assertThat(ActionMerger.resolve(action, EnvironmentStatus.ACTIVE)).isEqualTo(ActionPlan.REFRESH);
        assertThat(ActionMerger.resolve(action, EnvironmentStatus.UPDATING)).isEqualTo(ActionPlan.REFRESH);
    }

    @ParameterizedTest
    @EnumSource(value = ActionType.class, names = {"CREATE", "UPDATE"})
    @DisplayName("CREATE and UPDATE never interrupt a teardown")
    void deployActionsIgnoreDestroying(ActionType action) {
        assertThat(ActionMerger.resolve(action, EnvironmentStatus.DESTROYING)).isEqualTo(ActionPlan.NOOP);
    }

    @Test
    @DisplayName("DESTROY of a missing or destroyed environment is a no-op")
    void destroyOfNothingIsNoop() {
        assertThat(ActionMerger.resolve(ActionType.DESTROY, null)).isEqualTo(ActionPlan.NOOP);
        assertThat(ActionMerger.resolve(ActionType.DESTROY, EnvironmentStatus.DESTROYED)).isEqualTo(ActionPlan.NOOP);
    }

    @ParameterizedTest
    @EnumSource(value = EnvironmentStatus.class, names = {"CREATING", "ACTIVE", "UPDATING", "DESTROYING", "FAILED"})
    @DisplayName("DESTROY tears down every other state, including FAILED")
    void destroyTearsDown(EnvironmentStatus status) {
        assertThat(ActionMerger.resolve(ActionType.DESTROY, status)).isEqualTo(ActionPlan.TEARDOWN);
    }
}

package com.taskfactory.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkflowSettingsTest {

    @Test
    @DisplayName("Defaults limit ready and executing only")
    void defaults() {
        WorkflowSettings settings = WorkflowSettings.defaults();

        assertThat(settings.limitFor(Phase.READY)).isEqualTo(25);
        assertThat(settings.limitFor(Phase.EXECUTING)).isEqualTo(1);
        assertThat(settings.limitFor(Phase.BACKLOG)).isNull();
        assertThat(settings.limitFor(Phase.COMPLETE)).isNull();
        assertThat(settings.limitFor(Phase.ARCHIVED)).isNull();
        assertThat(settings.promoteOnPlanReady()).isFalse();
        assertThat(settings.autoExecute()).isTrue();
    }

    @Test
    @DisplayName("Workspace values win over global defaults, missing values fall back")
    void workspaceOverrideWins() {
        WorkspaceConfig config = WorkspaceConfig.empty()
            .withWipLimit(Phase.EXECUTING, 3)
            .withPromoteOnPlanReady(true);

        WorkflowSettings resolved = WorkflowSettings.defaults().resolve(config);

        assertThat(resolved.limitFor(Phase.EXECUTING)).isEqualTo(3);
        assertThat(resolved.limitFor(Phase.READY)).isEqualTo(25);
        assertThat(resolved.promoteOnPlanReady()).isTrue();
        assertThat(resolved.autoExecute()).isTrue();
    }

    @Test
    @DisplayName("Zero is a real limit, not unset")
    void zeroLimitIsKept() {
        WorkflowSettings resolved = WorkflowSettings.defaults()
            .resolve(WorkspaceConfig.empty().withWipLimit(Phase.READY, 0));

        assertThat(resolved.limitFor(Phase.READY)).isZero();
    }

    @Test
    @DisplayName("Auto-execute falls back to the queue-processing flag before the global default")
    void autoExecuteFallsBackToQueueFlag() {
        WorkflowSettings global = WorkflowSettings.defaults();

        assertThat(global.resolve(WorkspaceConfig.empty().withQueueProcessingEnabled(false)).autoExecute()).isFalse();
        assertThat(global.resolve(WorkspaceConfig.empty()
            .withQueueProcessingEnabled(false)
            .withAutoExecute(true)).autoExecute()).isTrue();
    }

    @Test
    @DisplayName("Null limits in the source map mean unlimited")
    void nullLimitsAreDropped() {
        java.util.HashMap<Phase, Integer> limits = new java.util.HashMap<>();
        limits.put(Phase.READY, null);
        limits.put(Phase.EXECUTING, 2);

        WorkflowSettings settings = new WorkflowSettings(limits, false, true);

        assertThat(settings.wipLimits()).isEqualTo(Map.of(Phase.EXECUTING, 2));
    }
}

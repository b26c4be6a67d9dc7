package com.taskfactory.engine.automation;

import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.engine.test.EngineFixture;
import com.taskfactory.engine.test.RecordingObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AutomationEngineTest {

    private EngineFixture engine;
    private Workspace workspace;
    private AutomationEngine automation;
    private List<String> kicks;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        automation = engine.automationEngine;
        workspace = engine.workspace("auto");
        kicks = engine.recordKicks();
    }

    @Test
    @DisplayName("Plan-ready promotion is off by default")
    void promotionOffByDefault() {
        Task task = engine.plannedTask(workspace, "planned");

        assertThat(automation.onPlanReady(workspace.id(), task.id())).isFalse();
        assertThat(engine.reload(task).phase()).isEqualTo(Phase.BACKLOG);
    }

    @Test
    @DisplayName("With promotion on, a planned backlog task moves to ready as the system")
    void promotesWhenEnabled() {
        automation.updateAutomation(workspace.id(), true, null);
        Task task = engine.plannedTask(workspace, "planned");

        assertThat(automation.onPlanReady(workspace.id(), task.id())).isTrue();

        Task promoted = engine.reload(task);
        assertThat(promoted.phase()).isEqualTo(Phase.READY);
        assertThat(promoted.history()).last()
            .satisfies(t -> assertThat(t.reason()).isEqualTo(AutomationEngine.PLAN_READY_REASON));
    }

    @Test
    @DisplayName("A full ready column leaves the task in backlog without an error")
    void fullReadyAbsorbed() {
        automation.updateAutomation(workspace.id(), true, null);
        engine.workspaceCoordinator.updateWipLimits(workspace.id(), Map.of(Phase.READY, 0));
        Task task = engine.plannedTask(workspace, "planned");

        assertThat(automation.onPlanReady(workspace.id(), task.id())).isFalse();
        assertThat(engine.reload(task).phase()).isEqualTo(Phase.BACKLOG);
    }

    @Test
    @DisplayName("Tasks outside backlog are never promoted")
    void onlyBacklogPromoted() {
        automation.updateAutomation(workspace.id(), true, null);
        Task ready = engine.readyTask(workspace, "already");

        assertThat(automation.onPlanReady(workspace.id(), ready.id())).isFalse();
    }

    @Test
    @DisplayName("Switching auto-execute back on wakes the queue and notifies observers")
    void reenablingAutoExecuteKicks() {
        RecordingObserver observer = new RecordingObserver("ui");
        engine.broadcastHub.connect(observer);
        engine.broadcastHub.subscribe("ui", workspace.id());

        automation.updateAutomation(workspace.id(), null, false);
        assertThat(kicks).isEmpty();
        assertThat(automation.isAutoExecuteEnabled(workspace.id())).isFalse();

        AutomationSettings settings = automation.updateAutomation(workspace.id(), null, true);

        assertThat(settings.autoExecute()).isTrue();
        assertThat(kicks).containsExactly(workspace.id());
        assertThat(observer.eventsOfType(EventType.WORKSPACE_AUTOMATION_UPDATED)).hasSize(2);
    }

    @Test
    @DisplayName("Workspace toggles fall back to global defaults")
    void fallsBackToGlobal() {
        engine.settingsResolver.updateGlobalDefaults(null, true, false);

        AutomationSettings settings = automation.settings(workspace.id());

        assertThat(settings.promoteOnPlanReady()).isTrue();
        assertThat(settings.autoExecute()).isFalse();
    }
}

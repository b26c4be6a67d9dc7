package com.taskfactory.engine.automation;

import com.taskfactory.core.exception.CapacityExceededException;
import com.taskfactory.core.exception.InvalidTransitionException;
import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.WorkflowSettings;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.config.WorkflowSettingsResolver;
import com.taskfactory.engine.queue.QueueKickCoordinator;
import com.taskfactory.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Applies the automation triggers: promote a planned backlog task to ready,
 * and wake the queue when auto-execute is switched on.
 */
public class AutomationEngine {

    private static final Logger log = LoggerFactory.getLogger(AutomationEngine.class);

    static final String PLAN_READY_REASON = "Plan ready";

    private final TaskService taskService;
    private final TaskRepository taskRepository;
    private final WorkspaceRepository workspaceRepository;
    private final WorkflowSettingsResolver settingsResolver;
    private final BroadcastHub broadcastHub;
    private final QueueKickCoordinator queueKickCoordinator;

    public AutomationEngine(
            TaskService taskService,
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            WorkflowSettingsResolver settingsResolver,
            BroadcastHub broadcastHub,
            QueueKickCoordinator queueKickCoordinator) {
        this.taskService = taskService;
        this.taskRepository = taskRepository;
        this.workspaceRepository = workspaceRepository;
        this.settingsResolver = settingsResolver;
        this.broadcastHub = broadcastHub;
        this.queueKickCoordinator = queueKickCoordinator;
    }

    /**
     * Called once a plan has been saved. Promotes the task to ready when the
     * workspace asks for it; a full ready column just leaves it in backlog.
     *
     * @return true if the task was promoted
     */
    public boolean onPlanReady(String workspaceId, String taskId) {
        if (!isPromoteOnPlanReadyEnabled(workspaceId)) {
            return false;
        }
        Optional<Task> task = taskRepository.findById(workspaceId, taskId);
        if (task.isEmpty() || task.get().phase() != Phase.BACKLOG) {
            return false;
        }
        try {
            taskService.move(workspaceId, taskId, Phase.READY, Actor.SYSTEM, PLAN_READY_REASON);
            log.info("Promoted task {} to ready after planning", taskId);
            return true;
        } catch (CapacityExceededException | InvalidTransitionException e) {
            log.debug("Task {} stays in backlog: {}", taskId, e.getMessage());
            return false;
        }
    }

    /**
     * Persist automation overrides. A null argument leaves that toggle unchanged.
     */
    public AutomationSettings updateAutomation(String workspaceId, Boolean promoteOnPlanReady, Boolean autoExecute) {
        boolean wasAutoExecute = isAutoExecuteEnabled(workspaceId);

        workspaceRepository.updateConfig(workspaceId, config -> {
            var updated = config;
            if (promoteOnPlanReady != null) {
                updated = updated.withPromoteOnPlanReady(promoteOnPlanReady);
            }
            if (autoExecute != null) {
                updated = updated.withAutoExecute(autoExecute);
            }
            return updated;
        });

        AutomationSettings settings = settings(workspaceId);
        log.info("Automation for workspace {} set to promoteOnPlanReady={}, autoExecute={}",
            workspaceId, settings.promoteOnPlanReady(), settings.autoExecute());
        broadcastHub.broadcast(workspaceId, EventType.WORKSPACE_AUTOMATION_UPDATED, null, Map.of(
            "promoteOnPlanReady", settings.promoteOnPlanReady(),
            "autoExecute", settings.autoExecute()));

        if (!wasAutoExecute && settings.autoExecute()) {
            queueKickCoordinator.requestKick(workspaceId);
        }
        return settings;
    }

    public AutomationSettings settings(String workspaceId) {
        WorkflowSettings resolved = settingsResolver.resolve(workspaceId);
        return new AutomationSettings(resolved.promoteOnPlanReady(), resolved.autoExecute());
    }

    public boolean isAutoExecuteEnabled(String workspaceId) {
        return settingsResolver.resolve(workspaceId).autoExecute();
    }

    public boolean isPromoteOnPlanReadyEnabled(String workspaceId) {
        return settingsResolver.resolve(workspaceId).promoteOnPlanReady();
    }
}

package com.taskfactory.engine.planning;

import com.taskfactory.agent.PlanningCollaborator;
import com.taskfactory.agent.PlanningRequest;
import com.taskfactory.core.exception.InvalidTransitionException;
import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.PlanningStatus;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.TaskPlan;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.automation.AutomationEngine;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.config.TaskFactoryProperties;
import com.taskfactory.engine.lock.WorkspaceLocks;
import com.taskfactory.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Drives plan generation for tasks and stores the result.
 *
 * The planning collaborator runs asynchronously; the returned future
 * completes with the task once its plan is saved, or exceptionally if
 * planning failed (the task then carries planning status ERROR).
 */
public class PlanningService {

    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    private final TaskRepository taskRepository;
    private final WorkspaceRepository workspaceRepository;
    private final PlanningCollaborator planningCollaborator;
    private final AutomationEngine automationEngine;
    private final ActivityService activityService;
    private final BroadcastHub broadcastHub;
    private final WorkspaceLocks workspaceLocks;
    private final TaskFactoryProperties properties;
    private final Clock clock;

    public PlanningService(
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            PlanningCollaborator planningCollaborator,
            AutomationEngine automationEngine,
            ActivityService activityService,
            BroadcastHub broadcastHub,
            WorkspaceLocks workspaceLocks,
            TaskFactoryProperties properties,
            Clock clock) {
        this.taskRepository = taskRepository;
        this.workspaceRepository = workspaceRepository;
        this.planningCollaborator = planningCollaborator;
        this.automationEngine = automationEngine;
        this.activityService = activityService;
        this.broadcastHub = broadcastHub;
        this.workspaceLocks = workspaceLocks;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Begin generating a plan.
     *
     * @throws InvalidTransitionException if planning is already running for the task
     */
    public CompletableFuture<Task> startPlanning(String workspaceId, String taskId) {
        Task task = workspaceLocks.withLock(workspaceId, () -> {
            Task running = taskRepository.modify(workspaceId, taskId, current -> {
                if (current.planningStatus() == PlanningStatus.RUNNING) {
                    throw new InvalidTransitionException(
                        String.format("Plan generation is already running for task %s", taskId));
                }
                return current.toBuilder()
                    .planningStatus(PlanningStatus.RUNNING)
                    .updatedAt(clock.instant())
                    .build();
            });
            broadcastHub.broadcast(workspaceId, EventType.TASK_UPDATED, taskId, Map.of("task", running));
            return running;
        });
        activityService.systemNote(workspaceId, taskId, "Plan generation started");
        return runPlanning(task);
    }

    /**
     * Restart planning that was cut off by a restart. The task keeps its
     * RUNNING status.
     */
    public CompletableFuture<Task> resumePlanning(Task task) {
        log.info("Resuming interrupted planning for task {}", task.id());
        return runPlanning(task);
    }

    /**
     * Store a plan, whoever produced it, then apply plan-ready automation.
     */
    public Task savePlan(String workspaceId, String taskId, TaskPlan plan) {
        TaskPlan stamped = plan.generatedAt() != null
            ? plan
            : new TaskPlan(plan.goal(), plan.steps(), plan.validation(), plan.cleanup(), clock.instant());

        Task saved = workspaceLocks.withLock(workspaceId, () -> {
            Task withPlan = taskRepository.modify(workspaceId, taskId, current -> current.toBuilder()
                .plan(stamped)
                .planningStatus(PlanningStatus.COMPLETED)
                .updatedAt(clock.instant())
                .build());
            broadcastHub.broadcast(workspaceId, EventType.TASK_PLAN_GENERATED, taskId, Map.of("task", withPlan));
            return withPlan;
        });

        try (var ctx = LoggingContext.forTask(workspaceId, taskId)) {
            log.info("Plan saved for task {} ({} steps)", taskId, stamped.steps().size());
        }
        activityService.systemNote(workspaceId, taskId, "Plan generated");

        automationEngine.onPlanReady(workspaceId, taskId);
        return taskRepository.findById(workspaceId, taskId).orElse(saved);
    }

    // ========== Internal Methods ==========

    private CompletableFuture<Task> runPlanning(Task task) {
        Workspace workspace = workspaceRepository.findById(task.workspaceId())
            .orElseThrow(() -> new NotFoundException("Workspace", task.workspaceId()));
        TaskFactoryProperties.Planning guardrails = properties.getPlanning();
        PlanningRequest request = PlanningRequest.from(
            task, workspace, guardrails.getMaxWallClock(), guardrails.getMaxToolCalls());

        CompletableFuture<TaskPlan> planned;
        try {
            planned = planningCollaborator.plan(request);
        } catch (RuntimeException e) {
            planned = CompletableFuture.failedFuture(e);
        }
        return planned
            .thenApply(plan -> savePlan(task.workspaceId(), task.id(), plan))
            .whenComplete((saved, error) -> {
                if (error != null) {
                    markFailed(task.workspaceId(), task.id(), unwrap(error));
                }
            });
    }

    private void markFailed(String workspaceId, String taskId, Throwable error) {
        try (var ctx = LoggingContext.forTask(workspaceId, taskId)) {
            log.warn("Planning failed for task {}: {}", taskId, error.getMessage());
            workspaceLocks.withLock(workspaceId, () -> {
                Task failed = taskRepository.modify(workspaceId, taskId, current -> current.toBuilder()
                    .planningStatus(PlanningStatus.ERROR)
                    .updatedAt(clock.instant())
                    .build());
                broadcastHub.broadcast(workspaceId, EventType.TASK_UPDATED, taskId, Map.of("task", failed));
            });
            activityService.systemNote(workspaceId, taskId, "Planning failed: " + error.getMessage());
        } catch (NotFoundException e) {
            log.debug("Task {} deleted before planning finished", taskId);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}

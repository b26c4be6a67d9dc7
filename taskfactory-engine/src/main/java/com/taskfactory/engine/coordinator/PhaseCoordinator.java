package com.taskfactory.engine.coordinator;

import com.taskfactory.core.admission.AdmissionController;
import com.taskfactory.core.admission.AdmissionDecision;
import com.taskfactory.core.exception.InvalidTransitionException;
import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.AcceptanceCriterion;
import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.QualityChecks;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.WorkflowSettings;
import com.taskfactory.core.repository.ActivityRepository;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.config.WorkflowSettingsResolver;
import com.taskfactory.engine.lock.WorkspaceLocks;
import com.taskfactory.engine.logging.LoggingContext;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import com.taskfactory.engine.queue.QueueKickCoordinator;
import com.taskfactory.engine.service.NewTask;
import com.taskfactory.engine.service.TaskService;
import com.taskfactory.engine.service.TaskUpdate;
import com.taskfactory.engine.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Coordinator for the task board.
 * Every change to a task runs inside the workspace lock together with the
 * event that announces it, so the WIP count checked is the count the move
 * applies to and observers see a workspace's events in the order they happened.
 */
public class PhaseCoordinator implements TaskService {

    private static final Logger log = LoggerFactory.getLogger(PhaseCoordinator.class);

    static final String PAUSED_NOTE = "Agent execution paused: task moved out of executing";

    private final TaskRepository taskRepository;
    private final WorkspaceRepository workspaceRepository;
    private final ActivityRepository activityRepository;
    private final WorkflowSettingsResolver settingsResolver;
    private final WorkspaceLocks workspaceLocks;
    private final SessionRegistry sessionRegistry;
    private final ActivityService activityService;
    private final BroadcastHub broadcastHub;
    private final QueueKickCoordinator queueKickCoordinator;
    private final TaskFactoryMetrics metrics;
    private final Clock clock;

    public PhaseCoordinator(
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            ActivityRepository activityRepository,
            WorkflowSettingsResolver settingsResolver,
            WorkspaceLocks workspaceLocks,
            SessionRegistry sessionRegistry,
            ActivityService activityService,
            BroadcastHub broadcastHub,
            QueueKickCoordinator queueKickCoordinator,
            TaskFactoryMetrics metrics,
            Clock clock) {
        this.taskRepository = taskRepository;
        this.workspaceRepository = workspaceRepository;
        this.activityRepository = activityRepository;
        this.settingsResolver = settingsResolver;
        this.workspaceLocks = workspaceLocks;
        this.sessionRegistry = sessionRegistry;
        this.activityService = activityService;
        this.broadcastHub = broadcastHub;
        this.queueKickCoordinator = queueKickCoordinator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Task createTask(String workspaceId, NewTask newTask) {
        requireWorkspace(workspaceId);

        Task created = workspaceLocks.withLock(workspaceId, () -> {
            WorkflowSettings settings = settingsResolver.resolve(workspaceId);
            AdmissionController.check(settings, taskRepository.countByPhase(workspaceId), null, Phase.BACKLOG)
                .orThrow();

            List<AcceptanceCriterion> criteria = newTask.acceptanceCriteria().stream()
                .map(AcceptanceCriterion::of)
                .collect(Collectors.toList());
            Task task = Task.create(
                workspaceId,
                taskRepository.nextTaskId(workspaceId),
                newTask.title(),
                newTask.description(),
                newTask.priority(),
                criteria,
                taskRepository.maxOrder(workspaceId, Phase.BACKLOG) + 1
            );
            taskRepository.save(task);
            broadcastHub.broadcast(workspaceId, EventType.TASK_CREATED, task.id(), Map.of("task", task));
            return task;
        });

        log.info("Created task {} in workspace {}", created.id(), workspaceId);
        return created;
    }

    @Override
    public Task updateTask(String workspaceId, String taskId, TaskUpdate update) {
        return workspaceLocks.withLock(workspaceId, () -> applyUpdate(workspaceId, taskId, update));
    }

    @Override
    public void deleteTask(String workspaceId, String taskId) {
        Task deleted = workspaceLocks.withLock(workspaceId, () -> {
            Task task = getTask(workspaceId, taskId);
            sessionRegistry.stop(workspaceId, taskId);
            taskRepository.delete(workspaceId, taskId);
            activityRepository.deleteByTask(workspaceId, taskId);
            sessionRegistry.forget(workspaceId, taskId);
            broadcastHub.broadcast(workspaceId, EventType.TASK_DELETED, taskId,
                Map.of("taskId", taskId, "phase", task.phase().wireName()));
            return task;
        });

        log.info("Deleted task {} from workspace {}", taskId, workspaceId);
        if (deleted.phase() == Phase.EXECUTING) {
            queueKickCoordinator.requestKick(workspaceId);
        }
    }

    @Override
    public Task getTask(String workspaceId, String taskId) {
        return taskRepository.findById(workspaceId, taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    @Override
    public List<Task> listTasks(String workspaceId, Phase phase) {
        requireWorkspace(workspaceId);
        return phase == null
            ? taskRepository.findByWorkspace(workspaceId)
            : taskRepository.findByPhase(workspaceId, phase);
    }

    @Override
    public Task move(String workspaceId, String taskId, Phase targetPhase, Actor actor, String reason) {
        try (var ctx = LoggingContext.forTask(workspaceId, taskId)) {
            return workspaceLocks.withLock(workspaceId, () -> doMove(workspaceId, taskId, targetPhase, actor, reason));
        }
    }

    @Override
    public List<Task> reorder(String workspaceId, Phase phase, List<String> orderedTaskIds) {
        List<Task> reordered = workspaceLocks.withLock(workspaceId, () -> {
            List<Task> inPhase = taskRepository.findByPhase(workspaceId, phase);
            Set<String> phaseIds = inPhase.stream().map(Task::id).collect(Collectors.toSet());

            Set<String> listed = new LinkedHashSet<>();
            for (String id : orderedTaskIds) {
                if (!phaseIds.contains(id)) {
                    throw new InvalidTransitionException(
                        String.format("Task %s is not in phase %s", id, phase.wireName()));
                }
                if (!listed.add(id)) {
                    throw new InvalidTransitionException(String.format("Task %s is listed twice", id));
                }
            }

            List<String> finalOrder = new ArrayList<>(listed);
            inPhase.stream()
                .map(Task::id)
                .filter(id -> !listed.contains(id))
                .forEach(finalOrder::add);

            Instant now = clock.instant();
            List<Task> result = new ArrayList<>();
            for (int position = 0; position < finalOrder.size(); position++) {
                long order = position;
                result.add(taskRepository.modify(workspaceId, finalOrder.get(position),
                    t -> t.toBuilder().order(order).updatedAt(now).build()));
            }
            List<String> ids = result.stream().map(Task::id).collect(Collectors.toList());
            broadcastHub.broadcast(workspaceId, EventType.TASK_REORDERED, null,
                Map.of("phase", phase.wireName(), "taskIds", ids));
            return result;
        });

        log.debug("Reordered {} in workspace {}: {} tasks", phase, workspaceId, reordered.size());
        return reordered;
    }

    // ========== Internal Methods ==========

    private Task applyUpdate(String workspaceId, String taskId, TaskUpdate update) {
        Task before = getTask(workspaceId, taskId);
        Instant now = clock.instant();

        Task updated = taskRepository.modify(workspaceId, taskId, current -> {
            Task.Builder builder = current.toBuilder().updatedAt(now);
            if (update.title() != null) {
                builder.title(update.title());
            }
            if (update.description() != null) {
                builder.description(update.description());
            }
            if (update.priority() != null) {
                builder.priority(update.priority());
            }
            if (update.acceptanceCriteria() != null) {
                builder.acceptanceCriteria(update.acceptanceCriteria());
            }
            if (update.qualityChecks() != null) {
                QualityChecks checks = current.qualityChecks();
                for (Map.Entry<String, Boolean> check : update.qualityChecks().entrySet()) {
                    checks = checks.with(check.getKey(), Boolean.TRUE.equals(check.getValue()));
                }
                builder.qualityChecks(checks);
            }
            if (update.blocked() != null) {
                builder.blocked(update.blocked(), update.blockedReason());
            }
            return builder.build();
        });

        broadcastHub.broadcast(workspaceId, EventType.TASK_UPDATED, taskId, Map.of("task", updated));
        if (before.blocked() && !updated.blocked() && updated.phase() == Phase.READY) {
            queueKickCoordinator.requestKick(workspaceId);
        }
        return updated;
    }

    private Task doMove(String workspaceId, String taskId, Phase targetPhase, Actor actor, String reason) {
        Task task = getTask(workspaceId, taskId);
        Phase from = task.phase();

        if (from == targetPhase) {
            log.debug("Task {} already in {}, move is a no-op", taskId, targetPhase);
            return task;
        }

        validateTransition(task, targetPhase);

        WorkflowSettings settings = settingsResolver.resolve(workspaceId);
        AdmissionDecision decision = AdmissionController.check(
            settings, taskRepository.countByPhase(workspaceId), from, targetPhase);
        if (!decision.allowed()) {
            metrics.capacityRejected(targetPhase);
            log.info("Move of task {} to {} refused: {}/{} in use",
                taskId, targetPhase, decision.current(), decision.limit());
            broadcastHub.broadcast(workspaceId, EventType.WIP_BREACH, taskId, Map.of(
                "phase", targetPhase.wireName(),
                "limit", decision.limit(),
                "current", decision.current()));
            decision.orThrow();
        }

        if (from == Phase.EXECUTING && sessionRegistry.stop(workspaceId, taskId)) {
            activityService.systemNote(workspaceId, taskId, PAUSED_NOTE);
        }

        long targetOrder = taskRepository.maxOrder(workspaceId, targetPhase) + 1;
        Instant now = clock.instant();
        Task moved = taskRepository.modify(workspaceId, taskId,
            current -> current.movedTo(targetPhase, targetOrder, actor, reason, now));

        metrics.taskMoved(from, targetPhase);
        log.info("Task {} moved {} -> {} by {}", taskId, from, targetPhase, actor);

        Map<String, Object> payload = new HashMap<>();
        payload.put("task", moved);
        payload.put("from", from.wireName());
        payload.put("to", targetPhase.wireName());
        payload.put("actor", actor.name());
        broadcastHub.broadcast(workspaceId, EventType.TASK_MOVED, taskId, payload);

        activityService.systemNote(workspaceId, taskId,
            String.format("Moved from %s to %s", from.wireName(), targetPhase.wireName()),
            Map.of("from", from.wireName(), "to", targetPhase.wireName(), "actor", actor.name()));
        if (targetPhase.isBackwardFrom(from) || targetPhase == Phase.EXECUTING) {
            activityService.separator(workspaceId, taskId, targetPhase);
        }

        if (targetPhase == Phase.READY || from == Phase.EXECUTING) {
            queueKickCoordinator.requestKick(workspaceId);
        }
        return moved;
    }

    private void validateTransition(Task task, Phase targetPhase) {
        if (targetPhase != Phase.EXECUTING) {
            return;
        }
        if (!task.hasPlan()) {
            throw new InvalidTransitionException(task.id(), task.phase(), targetPhase, "task has no plan");
        }
        if (task.blocked()) {
            String why = task.blockedReason() != null ? "task is blocked: " + task.blockedReason() : "task is blocked";
            throw new InvalidTransitionException(task.id(), task.phase(), targetPhase, why);
        }
    }

    private void requireWorkspace(String workspaceId) {
        if (workspaceRepository.findById(workspaceId).isEmpty()) {
            throw new NotFoundException("Workspace", workspaceId);
        }
    }
}

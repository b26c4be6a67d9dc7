package com.taskfactory.api.rest;

import com.taskfactory.agent.ImageAttachment;
import com.taskfactory.core.exception.SessionNotFoundException;
import com.taskfactory.core.model.ActivityEntry;
import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.TaskPlan;
import com.taskfactory.core.model.TaskPriority;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.chat.ChatOutcome;
import com.taskfactory.engine.chat.ChatService;
import com.taskfactory.engine.planning.PlanningService;
import com.taskfactory.engine.service.NewTask;
import com.taskfactory.engine.service.TaskService;
import com.taskfactory.engine.service.TaskUpdate;
import com.taskfactory.engine.session.SessionRegistry;
import com.taskfactory.engine.session.SessionSnapshot;
import com.taskfactory.scheduler.QueueCoordinator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the task board and the agent working on each task.
 */
@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}/tasks")
public class TaskController {

    private final TaskService taskService;
    private final PlanningService planningService;
    private final QueueCoordinator queueCoordinator;
    private final SessionRegistry sessionRegistry;
    private final ChatService chatService;
    private final ActivityService activityService;

    public TaskController(
            TaskService taskService,
            PlanningService planningService,
            QueueCoordinator queueCoordinator,
            SessionRegistry sessionRegistry,
            ChatService chatService,
            ActivityService activityService) {
        this.taskService = taskService;
        this.planningService = planningService;
        this.queueCoordinator = queueCoordinator;
        this.sessionRegistry = sessionRegistry;
        this.chatService = chatService;
        this.activityService = activityService;
    }

    /**
     * List tasks in board order, optionally only one phase.
     */
    @GetMapping
    public ResponseEntity<List<Task>> listTasks(
            @PathVariable String workspaceId,
            @RequestParam(required = false) Phase phase) {
        return ResponseEntity.ok(taskService.listTasks(workspaceId, phase));
    }

    @PostMapping
    public ResponseEntity<Task> createTask(
            @PathVariable String workspaceId,
            @Valid @RequestBody CreateTaskRequest request) {
        Task task = taskService.createTask(workspaceId, new NewTask(
            request.title(), request.description(), request.priority(), request.acceptanceCriteria()));
        return ResponseEntity.status(HttpStatus.CREATED).body(task);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<Task> getTask(@PathVariable String workspaceId, @PathVariable String taskId) {
        return ResponseEntity.ok(taskService.getTask(workspaceId, taskId));
    }

    /**
     * Update task fields. Phase changes go through the move endpoint.
     */
    @PatchMapping("/{taskId}")
    public ResponseEntity<Task> updateTask(
            @PathVariable String workspaceId,
            @PathVariable String taskId,
            @RequestBody TaskUpdate update) {
        return ResponseEntity.ok(taskService.updateTask(workspaceId, taskId, update));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> deleteTask(@PathVariable String workspaceId, @PathVariable String taskId) {
        taskService.deleteTask(workspaceId, taskId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Move a task to another phase (human action).
     */
    @PostMapping("/{taskId}/move")
    public ResponseEntity<Task> moveTask(
            @PathVariable String workspaceId,
            @PathVariable String taskId,
            @Valid @RequestBody MoveRequest request) {
        String reason = request.reason() != null ? request.reason() : "Moved by user";
        return ResponseEntity.ok(taskService.move(workspaceId, taskId, request.toPhase(), Actor.USER, reason));
    }

    @PostMapping("/reorder")
    public ResponseEntity<List<Task>> reorderTasks(
            @PathVariable String workspaceId,
            @Valid @RequestBody ReorderRequest request) {
        return ResponseEntity.ok(taskService.reorder(workspaceId, request.phase(), request.taskIds()));
    }

    // ========== Planning ==========

    /**
     * Store a plan produced outside the planning service.
     */
    @PostMapping("/{taskId}/plan")
    public ResponseEntity<Task> savePlan(
            @PathVariable String workspaceId,
            @PathVariable String taskId,
            @RequestBody TaskPlan plan) {
        return ResponseEntity.ok(planningService.savePlan(workspaceId, taskId, plan));
    }

    /**
     * Start plan generation. Returns as soon as the task is marked as planning.
     */
    @PostMapping("/{taskId}/planning")
    public ResponseEntity<Task> startPlanning(@PathVariable String workspaceId, @PathVariable String taskId) {
        planningService.startPlanning(workspaceId, taskId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(taskService.getTask(workspaceId, taskId));
    }

    // ========== Agent ==========

    /**
     * Start the agent on a task now, out of queue order but within the WIP limit.
     */
    @PostMapping("/{taskId}/execute")
    public ResponseEntity<SessionSnapshot> executeTask(
            @PathVariable String workspaceId,
            @PathVariable String taskId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(queueCoordinator.executeNow(workspaceId, taskId));
    }

    /**
     * Idempotent: {@code stopped} is false when nothing was running.
     */
    @PostMapping("/{taskId}/stop")
    public ResponseEntity<Map<String, Object>> stopTask(
            @PathVariable String workspaceId,
            @PathVariable String taskId) {
        taskService.getTask(workspaceId, taskId);
        boolean stopped = sessionRegistry.stop(workspaceId, taskId);
        return ResponseEntity.ok(Map.of("stopped", stopped));
    }

    /**
     * Deliver a message to the running agent mid-turn.
     */
    @PostMapping("/{taskId}/steer")
    public ResponseEntity<Map<String, Object>> steer(
            @PathVariable String workspaceId,
            @PathVariable String taskId,
            @Valid @RequestBody MessageRequest request) {
        taskService.getTask(workspaceId, taskId);
        if (!sessionRegistry.steer(workspaceId, taskId, request.message(), request.images())) {
            throw new SessionNotFoundException(taskId, "no running session to steer");
        }
        activityService.chatMessage(workspaceId, taskId, "user", request.message());
        return ResponseEntity.ok(Map.of("delivered", true));
    }

    /**
     * Answer an agent that is waiting for input.
     */
    @PostMapping("/{taskId}/follow-up")
    public ResponseEntity<Map<String, Object>> followUp(
            @PathVariable String workspaceId,
            @PathVariable String taskId,
            @Valid @RequestBody MessageRequest request) {
        taskService.getTask(workspaceId, taskId);
        if (!sessionRegistry.followUp(workspaceId, taskId, request.message(), request.images())) {
            throw new SessionNotFoundException(taskId, "session is not waiting for input");
        }
        activityService.chatMessage(workspaceId, taskId, "user", request.message());
        return ResponseEntity.ok(Map.of("delivered", true));
    }

    /**
     * Chat with the task's agent, whatever state its session is in.
     */
    @PostMapping("/{taskId}/chat")
    public ResponseEntity<Map<String, Object>> chat(
            @PathVariable String workspaceId,
            @PathVariable String taskId,
            @Valid @RequestBody MessageRequest request) {
        ChatOutcome outcome = chatService.send(workspaceId, taskId, request.message(), request.images());
        return ResponseEntity.ok(Map.of("outcome", outcome));
    }

    @GetMapping("/{taskId}/activity")
    public ResponseEntity<List<ActivityEntry>> getActivity(
            @PathVariable String workspaceId,
            @PathVariable String taskId,
            @RequestParam(defaultValue = "" + ActivityService.DEFAULT_PAGE_SIZE) int limit) {
        taskService.getTask(workspaceId, taskId);
        return ResponseEntity.ok(activityService.forTask(workspaceId, taskId, limit));
    }

    // ========== DTOs ==========

    public record CreateTaskRequest(
        @NotBlank String title,
        String description,
        TaskPriority priority,
        List<String> acceptanceCriteria
    ) {}

    public record MoveRequest(
        @NotNull Phase toPhase,
        String reason
    ) {}

    public record ReorderRequest(
        @NotNull Phase phase,
        @NotNull List<String> taskIds
    ) {}

    public record MessageRequest(
        @NotBlank String message,
        List<ImageAttachment> images
    ) {
        public MessageRequest {
            images = images != null ? images : List.of();
        }
    }
}

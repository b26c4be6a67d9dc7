package com.taskfactory.engine.chat;

import com.taskfactory.agent.ExecutionResult;
import com.taskfactory.agent.ImageAttachment;
import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.session.SessionRegistry;
import com.taskfactory.engine.session.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Routes user chat to a task's agent: steer a running session, follow up an
 * idle one, or open a conversation session.
 */
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final TaskRepository taskRepository;
    private final WorkspaceRepository workspaceRepository;
    private final SessionRegistry sessionRegistry;
    private final ActivityService activityService;

    public ChatService(
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            SessionRegistry sessionRegistry,
            ActivityService activityService) {
        this.taskRepository = taskRepository;
        this.workspaceRepository = workspaceRepository;
        this.sessionRegistry = sessionRegistry;
        this.activityService = activityService;
    }

    public ChatOutcome send(String workspaceId, String taskId, String message, List<ImageAttachment> images) {
        Task task = taskRepository.findById(workspaceId, taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
        Workspace workspace = workspaceRepository.findById(workspaceId)
            .orElseThrow(() -> new NotFoundException("Workspace", workspaceId));

        activityService.chatMessage(workspaceId, taskId, "user", message);

        if (sessionRegistry.steer(workspaceId, taskId, message, images)) {
            return ChatOutcome.STEERED;
        }
        if (sessionRegistry.followUp(workspaceId, taskId, message, images)) {
            return ChatOutcome.FOLLOWED_UP;
        }

        boolean resuming = task.sessionReference() != null;
        sessionRegistry.resumeOrStart(task, workspace, message, images, this::onConversationEnded);
        log.info("{} conversation for task {}", resuming ? "Resumed" : "Started", taskId);
        return resuming ? ChatOutcome.RESUMED : ChatOutcome.STARTED;
    }

    private void onConversationEnded(SessionSnapshot session, ExecutionResult result) {
        if (result.success()) {
            if (result.summary() != null) {
                activityService.chatMessage(session.workspaceId(), session.taskId(), "agent", result.summary());
            }
        } else {
            activityService.systemNote(session.workspaceId(), session.taskId(),
                "Agent conversation failed: " + result.errorMessage());
        }
    }
}

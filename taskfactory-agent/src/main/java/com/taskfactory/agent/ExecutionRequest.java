package com.taskfactory.agent;

import com.taskfactory.core.model.AcceptanceCriterion;
import com.taskfactory.core.model.SessionPurpose;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.TaskPlan;
import com.taskfactory.core.model.Workspace;

import java.util.List;

/**
 * Everything the execution collaborator needs to open a session for a task.
 */
public record ExecutionRequest(
    String workspaceId,
    String workspacePath,
    String taskId,
    String title,
    String description,
    TaskPlan plan,
    List<String> acceptanceCriteria,
    SessionPurpose purpose,
    String resumeReference,
    String initialMessage,
    List<ImageAttachment> images
) {
    public ExecutionRequest {
        acceptanceCriteria = acceptanceCriteria != null ? List.copyOf(acceptanceCriteria) : List.of();
        images = images != null ? List.copyOf(images) : List.of();
    }

    /**
     * Request for an execution session working through the task's plan.
     */
    public static ExecutionRequest forExecution(Task task, Workspace workspace) {
        return new ExecutionRequest(
            workspace.id(),
            workspace.rootPath(),
            task.id(),
            task.title(),
            task.description(),
            task.plan(),
            criteria(task),
            SessionPurpose.EXECUTION,
            null,
            null,
            List.of()
        );
    }

    /**
     * Request for a conversation about the task, continuing its transcript when one exists.
     */
    public static ExecutionRequest forConversation(Task task, Workspace workspace, String message,
                                                   List<ImageAttachment> images) {
        return new ExecutionRequest(
            workspace.id(),
            workspace.rootPath(),
            task.id(),
            task.title(),
            task.description(),
            task.plan(),
            criteria(task),
            SessionPurpose.CONVERSATION,
            task.sessionReference(),
            message,
            images
        );
    }

    private static List<String> criteria(Task task) {
        return task.acceptanceCriteria().stream()
            .map(AcceptanceCriterion::text)
            .toList();
    }
}

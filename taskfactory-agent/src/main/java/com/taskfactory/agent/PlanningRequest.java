package com.taskfactory.agent;

import com.taskfactory.core.model.AcceptanceCriterion;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;

import java.time.Duration;
import java.util.List;

/**
 * Plan generation request. The guardrails are enforced by the planning side.
 */
public record PlanningRequest(
    String workspaceId,
    String workspacePath,
    String taskId,
    String title,
    String description,
    List<String> acceptanceCriteria,
    Duration maxWallClock,
    int maxToolCalls
) {
    public static PlanningRequest from(Task task, Workspace workspace, Duration maxWallClock, int maxToolCalls) {
        return new PlanningRequest(
            workspace.id(),
            workspace.rootPath(),
            task.id(),
            task.title(),
            task.description(),
            task.acceptanceCriteria().stream().map(AcceptanceCriterion::text).toList(),
            maxWallClock,
            maxToolCalls
        );
    }
}

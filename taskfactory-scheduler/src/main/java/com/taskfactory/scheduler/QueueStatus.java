package com.taskfactory.scheduler;

import java.util.List;

/**
 * Snapshot of a workspace queue, as shown to observers and the API.
 */
public record QueueStatus(
    String workspaceId,
    boolean enabled,
    List<String> runningTaskIds,
    int tasksInReady,
    int tasksInExecuting,
    BreakerStatus breaker
) {
    public QueueStatus {
        runningTaskIds = runningTaskIds != null ? List.copyOf(runningTaskIds) : List.of();
    }
}

package com.taskfactory.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * A state-change notification for one workspace.
 *
 * Invariants:
 * - sequence is strictly increasing per workspace, in broadcast order
 */
public record WorkspaceEvent(
    String workspaceId,
    long sequence,
    EventType type,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {
    public WorkspaceEvent {
        payload = payload != null ? payload : Map.of();
    }
}

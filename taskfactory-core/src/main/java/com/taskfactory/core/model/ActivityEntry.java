package com.taskfactory.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A line in a task's activity feed: system notes, chat turns and section markers.
 */
public record ActivityEntry(
    String id,
    String workspaceId,
    String taskId,
    ActivityKind kind,
    String content,
    Map<String, Object> metadata,
    Instant timestamp
) {
    public ActivityEntry {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static ActivityEntry systemEvent(String workspaceId, String taskId, String content, Map<String, Object> metadata) {
        return new ActivityEntry(UUID.randomUUID().toString(), workspaceId, taskId,
            ActivityKind.SYSTEM_EVENT, content, metadata, Instant.now());
    }

    public static ActivityEntry chatMessage(String workspaceId, String taskId, String role, String content) {
        return new ActivityEntry(UUID.randomUUID().toString(), workspaceId, taskId,
            ActivityKind.CHAT_MESSAGE, content, Map.of("role", role), Instant.now());
    }

    public static ActivityEntry separator(String workspaceId, String taskId, Phase phase) {
        return new ActivityEntry(UUID.randomUUID().toString(), workspaceId, taskId,
            ActivityKind.TASK_SEPARATOR, "Entered " + phase.wireName(), Map.of("phase", phase.wireName()), Instant.now());
    }
}

package com.taskfactory.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Clarifying questions from an agent, waiting for a human.
 * At most one per workspace by contract of the agent side.
 */
public record PendingQARequest(
    String requestId,
    String workspaceId,
    String taskId,
    List<QAQuestion> questions,
    Instant createdAt
) {
    public PendingQARequest {
        questions = questions != null ? List.copyOf(questions) : List.of();
    }

    public static PendingQARequest create(String workspaceId, String taskId, List<QAQuestion> questions) {
        return new PendingQARequest(UUID.randomUUID().toString(), workspaceId, taskId, questions, Instant.now());
    }
}

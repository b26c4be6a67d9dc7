package com.taskfactory.engine.session;

import com.taskfactory.core.model.SessionPurpose;
import com.taskfactory.core.model.SessionStatus;

import java.time.Instant;

/**
 * Point-in-time view of an agent session. {@code sessionId} and
 * {@code sessionReference} are null until the collaborator has opened it.
 */
public record SessionSnapshot(
    String attemptId,
    String sessionId,
    String sessionReference,
    String workspaceId,
    String taskId,
    SessionPurpose purpose,
    SessionStatus status,
    Instant startedAt,
    Instant endedAt
) {
}

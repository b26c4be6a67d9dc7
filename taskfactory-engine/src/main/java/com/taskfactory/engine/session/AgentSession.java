package com.taskfactory.engine.session;

import com.taskfactory.agent.ExecutionHandle;
import com.taskfactory.core.model.SessionPurpose;
import com.taskfactory.core.model.SessionStatus;

import java.time.Instant;

/**
 * Registry entry for one attempt at running an agent on a task.
 * Mutated only under the registry's per-task monitor.
 */
final class AgentSession {

    private final String attemptId;
    private final String workspaceId;
    private final String taskId;
    private final SessionPurpose purpose;
    private final Instant startedAt;

    private volatile SessionStatus status = SessionStatus.RUNNING;
    private volatile ExecutionHandle handle;
    private volatile Instant endedAt;

    AgentSession(String attemptId, String workspaceId, String taskId, SessionPurpose purpose, Instant startedAt) {
        this.attemptId = attemptId;
        this.workspaceId = workspaceId;
        this.taskId = taskId;
        this.purpose = purpose;
        this.startedAt = startedAt;
    }

    String attemptId() {
        return attemptId;
    }

    String workspaceId() {
        return workspaceId;
    }

    String taskId() {
        return taskId;
    }

    SessionPurpose purpose() {
        return purpose;
    }

    SessionStatus status() {
        return status;
    }

    ExecutionHandle handle() {
        return handle;
    }

    void attach(ExecutionHandle handle) {
        this.handle = handle;
    }

    void status(SessionStatus status) {
        this.status = status;
    }

    void finish(SessionStatus finalStatus, Instant at) {
        this.status = finalStatus;
        this.endedAt = at;
    }

    SessionSnapshot snapshot() {
        ExecutionHandle h = handle;
        return new SessionSnapshot(
            attemptId,
            h != null ? h.sessionId() : null,
            h != null ? h.sessionReference() : null,
            workspaceId,
            taskId,
            purpose,
            status,
            startedAt,
            endedAt
        );
    }
}

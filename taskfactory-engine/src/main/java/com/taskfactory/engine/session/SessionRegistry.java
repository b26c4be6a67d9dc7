package com.taskfactory.engine.session;

import com.taskfactory.agent.AgentException;
import com.taskfactory.agent.DeliveryMode;
import com.taskfactory.agent.ExecutionCollaborator;
import com.taskfactory.agent.ExecutionHandle;
import com.taskfactory.agent.ExecutionListener;
import com.taskfactory.agent.ExecutionRequest;
import com.taskfactory.agent.ExecutionResult;
import com.taskfactory.agent.ImageAttachment;
import com.taskfactory.core.exception.AlreadyRunningException;
import com.taskfactory.core.exception.ExecutionFailedException;
import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.SessionStatus;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.logging.LoggingContext;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Owns the live agent sessions, at most one per task.
 *
 * Operations on one task are serialized by a per-task monitor. A session is
 * in the registry exactly while it is live (running or idle); stopping or
 * finishing removes it, so a late callback from an older attempt finds a
 * different entry (or none) and is ignored. The id of the most recent
 * attempt per task outlives the entry, so outcomes handed off for later
 * processing can still be matched against it.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ExecutionCollaborator collaborator;
    private final TaskRepository taskRepository;
    private final BroadcastHub broadcastHub;
    private final TaskFactoryMetrics metrics;
    private final Clock clock;
    private final Duration stopTimeout;

    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Object> monitors = new ConcurrentHashMap<>();
    private final Map<String, String> latestAttempts = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public SessionRegistry(
            ExecutionCollaborator collaborator,
            TaskRepository taskRepository,
            BroadcastHub broadcastHub,
            TaskFactoryMetrics metrics,
            Clock clock,
            Duration stopTimeout) {
        this.collaborator = collaborator;
        this.taskRepository = taskRepository;
        this.broadcastHub = broadcastHub;
        this.metrics = metrics;
        this.clock = clock;
        this.stopTimeout = stopTimeout;
    }

    /**
     * Open an execution session for a task that sits in executing.
     *
     * @throws AlreadyRunningException if the task already has a live session
     * @throws ExecutionFailedException if the collaborator could not open one
     */
    public SessionSnapshot start(Task task, Workspace workspace, ExecutionOutcomeListener outcomeListener) {
        return open(task, ExecutionRequest.forExecution(task, workspace), outcomeListener);
    }

    /**
     * Deliver a message mid-turn. Only a running session accepts steering.
     *
     * @return false if there is no running session
     */
    public boolean steer(String workspaceId, String taskId, String message, List<ImageAttachment> images) {
        String key = key(workspaceId, taskId);
        synchronized (monitor(key)) {
            AgentSession session = sessions.get(key);
            if (session == null || session.status() != SessionStatus.RUNNING || session.handle() == null) {
                return false;
            }
            deliver(session, message, images, DeliveryMode.STEER);
            return true;
        }
    }

    /**
     * Deliver a message to a session waiting for input, which resumes it.
     *
     * @return false if there is no idle session
     */
    public boolean followUp(String workspaceId, String taskId, String message, List<ImageAttachment> images) {
        String key = key(workspaceId, taskId);
        AgentSession session;
        synchronized (monitor(key)) {
            session = sessions.get(key);
            if (session == null || session.status() != SessionStatus.IDLE || session.handle() == null) {
                return false;
            }
            deliver(session, message, images, DeliveryMode.FOLLOW_UP);
            session.status(SessionStatus.RUNNING);
        }
        broadcastStatus(session, SessionStatus.RUNNING, null);
        return true;
    }

    /**
     * Route a chat message to the task's agent. A live session receives it
     * directly; otherwise a conversation session opens, continuing the task's
     * previous transcript when it has one.
     */
    public SessionSnapshot resumeOrStart(Task task, Workspace workspace, String message,
                                         List<ImageAttachment> images, ExecutionOutcomeListener outcomeListener) {
        String key = key(task.workspaceId(), task.id());
        synchronized (monitor(key)) {
            AgentSession existing = sessions.get(key);
            if (existing != null) {
                if (existing.status() == SessionStatus.IDLE) {
                    followUp(task.workspaceId(), task.id(), message, images);
                } else {
                    deliver(existing, message, images, DeliveryMode.STEER);
                }
                return existing.snapshot();
            }
            return open(task, ExecutionRequest.forConversation(task, workspace, message, images), outcomeListener);
        }
    }

    /**
     * Stop the task's session and wait (bounded) for the collaborator to
     * confirm. Idempotent.
     *
     * @return true if a session was stopped
     */
    public boolean stop(String workspaceId, String taskId) {
        String key = key(workspaceId, taskId);
        AgentSession session;
        synchronized (monitor(key)) {
            session = sessions.remove(key);
            if (session == null) {
                return false;
            }
            session.finish(SessionStatus.PAUSED, clock.instant());
        }
        metrics.syncLiveSessions(sessions.size());
        metrics.sessionEnded(session.purpose(), "stopped");

        awaitStop(session);

        try (var ctx = LoggingContext.forSession(workspaceId, taskId, session.snapshot().sessionId())) {
            log.info("Stopped {} session for task {}", session.purpose(), taskId);
        }
        broadcastStatus(session, SessionStatus.PAUSED, null);
        return true;
    }

    /**
     * Stop every session of a workspace.
     *
     * @return number of sessions stopped
     */
    public int stopWorkspace(String workspaceId) {
        int stopped = 0;
        for (AgentSession session : List.copyOf(sessions.values())) {
            if (session.workspaceId().equals(workspaceId) && stop(workspaceId, session.taskId())) {
                stopped++;
            }
        }
        return stopped;
    }

    public int stopAll() {
        int stopped = 0;
        for (AgentSession session : List.copyOf(sessions.values())) {
            if (stop(session.workspaceId(), session.taskId())) {
                stopped++;
            }
        }
        return stopped;
    }

    /**
     * Refuse new sessions and stop the live ones.
     */
    public void shutdown() {
        closed = true;
        int stopped = stopAll();
        log.info("Session registry shut down, {} sessions stopped", stopped);
    }

    /**
     * Drop per-task bookkeeping for a deleted task. The session must already be stopped.
     */
    public void forget(String workspaceId, String taskId) {
        String key = key(workspaceId, taskId);
        latestAttempts.remove(key);
        monitors.remove(key);
    }

    /**
     * Whether the attempt is the most recent one opened for its task. Stays
     * true after the attempt finishes, until another one opens.
     */
    public boolean isLatestAttempt(SessionSnapshot session) {
        return session.attemptId().equals(latestAttempts.get(key(session.workspaceId(), session.taskId())));
    }

    public Optional<SessionStatus> status(String workspaceId, String taskId) {
        return Optional.ofNullable(sessions.get(key(workspaceId, taskId))).map(AgentSession::status);
    }

    public Optional<SessionSnapshot> snapshot(String workspaceId, String taskId) {
        return Optional.ofNullable(sessions.get(key(workspaceId, taskId))).map(AgentSession::snapshot);
    }

    public boolean hasLiveSession(String workspaceId, String taskId) {
        AgentSession session = sessions.get(key(workspaceId, taskId));
        return session != null && session.status().isLive();
    }

    public List<SessionSnapshot> activeSessions() {
        return sessions.values().stream()
            .map(AgentSession::snapshot)
            .collect(Collectors.toList());
    }

    public Set<String> liveTaskIds(String workspaceId) {
        return sessions.values().stream()
            .filter(s -> s.workspaceId().equals(workspaceId))
            .map(AgentSession::taskId)
            .collect(Collectors.toSet());
    }

    public int liveSessionCount() {
        return sessions.size();
    }

    // ========== Internal Methods ==========

    private SessionSnapshot open(Task task, ExecutionRequest request, ExecutionOutcomeListener outcomeListener) {
        if (closed) {
            throw new ExecutionFailedException(task.id(), "Session registry is shut down");
        }
        String key = key(task.workspaceId(), task.id());
        AgentSession session;
        synchronized (monitor(key)) {
            if (sessions.containsKey(key)) {
                throw new AlreadyRunningException(task.id());
            }
            session = new AgentSession(UUID.randomUUID().toString(), task.workspaceId(), task.id(),
                request.purpose(), clock.instant());
            sessions.put(key, session);
            String previousAttempt = latestAttempts.put(key, session.attemptId());

            ExecutionHandle handle;
            try {
                handle = collaborator.open(request, new AttemptListener(key, session, outcomeListener));
            } catch (AgentException e) {
                sessions.remove(key, session);
                restoreLatestAttempt(key, previousAttempt);
                log.warn("Agent refused {} session for task {}: {}", request.purpose(), task.id(), e.getMessage());
                throw new ExecutionFailedException(task.id(), e.getMessage(), e);
            } catch (RuntimeException e) {
                sessions.remove(key, session);
                restoreLatestAttempt(key, previousAttempt);
                log.error("Unexpected error opening session for task {}", task.id(), e);
                throw new ExecutionFailedException(task.id(), e.getMessage(), e);
            }
            session.attach(handle);
            metrics.syncLiveSessions(sessions.size());
            metrics.sessionStarted(request.purpose());

            if (sessions.get(key) != session) {
                log.debug("Session for task {} finished while it was opening", task.id());
                return session.snapshot();
            }
        }

        String reference = session.handle().sessionReference();
        try {
            taskRepository.modify(task.workspaceId(), task.id(), t -> t.toBuilder()
                .sessionReference(reference)
                .updatedAt(clock.instant())
                .build());
        } catch (NotFoundException e) {
            log.debug("Task {} deleted while its session was opening", task.id());
        }

        try (var ctx = LoggingContext.forSession(task.workspaceId(), task.id(), session.handle().sessionId())) {
            log.info("Started {} session for task {} (attempt {})", request.purpose(), task.id(), session.attemptId());
        }
        broadcastStatus(session, SessionStatus.RUNNING, null);
        return session.snapshot();
    }

    private void restoreLatestAttempt(String key, String previousAttempt) {
        if (previousAttempt != null) {
            latestAttempts.put(key, previousAttempt);
        } else {
            latestAttempts.remove(key);
        }
    }

    private void deliver(AgentSession session, String message, List<ImageAttachment> images, DeliveryMode mode) {
        try {
            session.handle().deliver(message, images, mode);
        } catch (AgentException e) {
            log.warn("Failed to deliver {} message to task {}: {}", mode, session.taskId(), e.getMessage());
            throw new ExecutionFailedException(session.taskId(), e.getMessage(), e);
        }
    }

    private void awaitStop(AgentSession session) {
        ExecutionHandle handle = session.handle();
        if (handle == null) {
            return;
        }
        try {
            handle.stop().get(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Session for task {} did not confirm stop within {}", session.taskId(), stopTimeout);
        } catch (ExecutionException e) {
            log.warn("Stopping session for task {} failed: {}", session.taskId(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping session for task {}", session.taskId());
        }
    }

    private void onStatusChange(String key, AgentSession session, SessionStatus status) {
        synchronized (monitor(key)) {
            if (sessions.get(key) != session) {
                log.debug("Ignoring {} from stale attempt {} of task {}", status, session.attemptId(), session.taskId());
                return;
            }
            session.status(status);
        }
        broadcastStatus(session, status, null);
    }

    private void onCompleted(String key, AgentSession session, ExecutionResult result,
                             ExecutionOutcomeListener outcomeListener) {
        SessionStatus finalStatus = result.success() ? SessionStatus.COMPLETED : SessionStatus.ERROR;
        synchronized (monitor(key)) {
            if (sessions.get(key) != session) {
                log.debug("Ignoring completion from stale attempt {} of task {}", session.attemptId(), session.taskId());
                return;
            }
            sessions.remove(key);
            session.finish(finalStatus, clock.instant());
        }
        metrics.syncLiveSessions(sessions.size());
        metrics.sessionEnded(session.purpose(), result.success() ? "completed" : "failed");

        SessionSnapshot snapshot = session.snapshot();
        try (var ctx = LoggingContext.forSession(session.workspaceId(), session.taskId(), snapshot.sessionId())) {
            if (result.success()) {
                log.info("{} session for task {} completed", session.purpose(), session.taskId());
            } else {
                log.info("{} session for task {} failed: {}", session.purpose(), session.taskId(), result.errorMessage());
            }
        }
        broadcastStatus(session, finalStatus, result.errorMessage());

        try {
            outcomeListener.onOutcome(snapshot, result);
        } catch (RuntimeException e) {
            log.error("Outcome listener failed for task {}", session.taskId(), e);
        }
    }

    private void broadcastStatus(AgentSession session, SessionStatus status, String error) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("status", status.wireName());
        payload.put("purpose", session.purpose().name().toLowerCase());
        payload.put("attemptId", session.attemptId());
        ExecutionHandle handle = session.handle();
        if (handle != null) {
            payload.put("sessionId", handle.sessionId());
        }
        if (error != null) {
            payload.put("error", error);
        }
        broadcastHub.broadcast(session.workspaceId(), EventType.AGENT_EXECUTION_STATUS, session.taskId(), payload);
    }

    private Object monitor(String key) {
        return monitors.computeIfAbsent(key, k -> new Object());
    }

    private static String key(String workspaceId, String taskId) {
        return workspaceId + "/" + taskId;
    }

    /**
     * Collaborator callbacks bound to one attempt.
     */
    private final class AttemptListener implements ExecutionListener {

        private final String key;
        private final AgentSession session;
        private final ExecutionOutcomeListener outcomeListener;

        private AttemptListener(String key, AgentSession session, ExecutionOutcomeListener outcomeListener) {
            this.key = key;
            this.session = session;
            this.outcomeListener = outcomeListener;
        }

        @Override
        public void onRunning() {
            onStatusChange(key, session, SessionStatus.RUNNING);
        }

        @Override
        public void onIdle() {
            onStatusChange(key, session, SessionStatus.IDLE);
        }

        @Override
        public void onCompleted(ExecutionResult result) {
            SessionRegistry.this.onCompleted(key, session, result, outcomeListener);
        }
    }
}

package com.taskfactory.scheduler;

import com.taskfactory.agent.ExecutionResult;
import com.taskfactory.core.admission.AdmissionController;
import com.taskfactory.core.exception.AlreadyRunningException;
import com.taskfactory.core.exception.ExecutionFailedException;
import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.exception.TaskFactoryException;
import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.WorkflowSettings;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.config.WorkflowSettingsResolver;
import com.taskfactory.engine.lock.WorkspaceLocks;
import com.taskfactory.engine.logging.LoggingContext;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import com.taskfactory.engine.service.TaskService;
import com.taskfactory.engine.session.SessionRegistry;
import com.taskfactory.engine.session.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Dispatches ready tasks of one workspace to the agent, FIFO by board order,
 * within the executing WIP limit.
 *
 * A single-thread executor is the workspace's event loop: scans and
 * execution outcomes are posted to it and run one at a time. Kicks coalesce,
 * so any number of kicks while a scan is pending produce one scan.
 */
public class QueueManager {

    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    static final String AUTO_ASSIGN_REASON = "Queue manager auto-assigned";
    static final String COMPLETED_REASON = "Agent execution completed";
    static final String MANUAL_EXECUTE_REASON = "Manual execute";

    private final String workspaceId;
    private final TaskService taskService;
    private final TaskRepository taskRepository;
    private final WorkspaceRepository workspaceRepository;
    private final WorkflowSettingsResolver settingsResolver;
    private final WorkspaceLocks workspaceLocks;
    private final SessionRegistry sessionRegistry;
    private final ActivityService activityService;
    private final BroadcastHub broadcastHub;
    private final ExecutionBreaker breaker;
    private final TaskFactoryMetrics metrics;
    private final ScheduledExecutorService timer;
    private final Duration startRetryDelay;
    private final Clock clock;

    private final ExecutorService inbox;
    private final AtomicBoolean scanPending = new AtomicBoolean(false);
    private final AtomicInteger queued = new AtomicInteger();
    private volatile boolean stopped;

    public QueueManager(
            String workspaceId,
            TaskService taskService,
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            WorkflowSettingsResolver settingsResolver,
            WorkspaceLocks workspaceLocks,
            SessionRegistry sessionRegistry,
            ActivityService activityService,
            BroadcastHub broadcastHub,
            ExecutionBreaker breaker,
            TaskFactoryMetrics metrics,
            ScheduledExecutorService timer,
            Duration startRetryDelay,
            Clock clock) {
        this.workspaceId = workspaceId;
        this.taskService = taskService;
        this.taskRepository = taskRepository;
        this.workspaceRepository = workspaceRepository;
        this.settingsResolver = settingsResolver;
        this.workspaceLocks = workspaceLocks;
        this.sessionRegistry = sessionRegistry;
        this.activityService = activityService;
        this.broadcastHub = broadcastHub;
        this.breaker = breaker;
        this.metrics = metrics;
        this.timer = timer;
        this.startRetryDelay = startRetryDelay;
        this.clock = clock;
        this.inbox = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "queue-" + workspaceId);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Request a scan. Returns immediately.
     */
    public void kick() {
        if (stopped) {
            return;
        }
        if (scanPending.compareAndSet(false, true)) {
            post(this::scan);
        }
    }

    /**
     * Start a task right away, bypassing FIFO order but not the WIP limit.
     * Moves the task to executing first unless it is already there.
     *
     * @throws AlreadyRunningException if the task already has a live session
     * @throws ExecutionFailedException if the agent refused the session
     */
    public SessionSnapshot executeNow(String taskId) {
        Workspace workspace = workspace();
        try (var ctx = LoggingContext.forTask(workspaceId, taskId)) {
            SessionSnapshot snapshot = workspaceLocks.withLock(workspaceId, () -> {
                if (sessionRegistry.hasLiveSession(workspaceId, taskId)) {
                    throw new AlreadyRunningException(taskId);
                }
                Task task = taskService.getTask(workspaceId, taskId);
                if (task.phase() != Phase.EXECUTING) {
                    task = taskService.move(workspaceId, taskId, Phase.EXECUTING, Actor.USER, MANUAL_EXECUTE_REASON);
                } else if (task.hasExecutionError()) {
                    task = taskRepository.modify(workspaceId, taskId, t -> t.toBuilder()
                        .executionError(null)
                        .updatedAt(clock.instant())
                        .build());
                }
                try {
                    return sessionRegistry.start(task, workspace, this::postOutcome);
                } catch (ExecutionFailedException e) {
                    recordStartFailure(task, e);
                    throw e;
                }
            });
            metrics.queueDispatched(true);
            log.info("Task {} started manually", taskId);
            broadcastStatus();
            return snapshot;
        }
    }

    public QueueStatus status() {
        List<Task> ready = taskRepository.findByPhase(workspaceId, Phase.READY);
        List<Task> executing = taskRepository.findByPhase(workspaceId, Phase.EXECUTING);
        Set<String> live = sessionRegistry.liveTaskIds(workspaceId);
        List<String> running = executing.stream()
            .map(Task::id)
            .filter(live::contains)
            .collect(Collectors.toList());
        return new QueueStatus(
            workspaceId,
            settingsResolver.resolve(workspaceId).autoExecute(),
            running,
            ready.size(),
            executing.size(),
            breaker.status());
    }

    public ExecutionBreaker breaker() {
        return breaker;
    }

    /**
     * Wait until every posted scan and outcome, including those they post in
     * turn, has run.
     *
     * @return false if the inbox did not drain within the timeout
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (queued.get() > 0) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            try {
                inbox.submit(() -> { }).get(remaining, TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                return queued.get() == 0;
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                throw new IllegalStateException("Flush marker failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    /**
     * Stop dispatching. Live sessions keep running; their outcomes are dropped.
     */
    public void stop() {
        stopped = true;
        inbox.shutdown();
        try {
            if (!inbox.awaitTermination(10, TimeUnit.SECONDS)) {
                inbox.shutdownNow();
            }
        } catch (InterruptedException e) {
            inbox.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Queue manager for workspace {} stopped", workspaceId);
    }

    public boolean isStopped() {
        return stopped;
    }

    // ========== Internal Methods ==========

    private void post(Runnable action) {
        queued.incrementAndGet();
        try {
            inbox.execute(() -> {
                try {
                    action.run();
                } finally {
                    queued.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            queued.decrementAndGet();
            log.debug("Queue for workspace {} is stopped, dropping work", workspaceId);
        }
    }

    private void scan() {
        scanPending.set(false);
        try (var ctx = LoggingContext.forWorkspace(workspaceId)) {
            int dispatched = 0;
            while (dispatchNext()) {
                dispatched++;
            }
            if (dispatched > 0) {
                log.info("Dispatched {} task(s) in workspace {}", dispatched, workspaceId);
                broadcastStatus();
            }
        } catch (NotFoundException e) {
            log.debug("Workspace {} is gone, scan skipped", workspaceId);
        } catch (RuntimeException e) {
            log.error("Queue scan failed for workspace {}", workspaceId, e);
        }
    }

    /**
     * @return true if a task was moved to executing and the loop should look for another
     */
    private boolean dispatchNext() {
        if (stopped) {
            return false;
        }
        WorkflowSettings settings = settingsResolver.resolve(workspaceId);
        if (!settings.autoExecute()) {
            return false;
        }
        if (breaker.isOpen()) {
            log.debug("Execution breaker open for workspace {}, not dispatching", workspaceId);
            return false;
        }
        Workspace workspace = workspace();

        return workspaceLocks.withLock(workspaceId, () -> {
            WorkflowSettings current = settingsResolver.resolve(workspaceId);
            if (AdmissionController.remainingCapacity(
                    current, taskRepository.countByPhase(workspaceId), Phase.EXECUTING) == 0) {
                return false;
            }

            Optional<Task> candidate = taskRepository.findByPhase(workspaceId, Phase.READY).stream()
                .filter(this::isEligible)
                .findFirst();
            if (candidate.isEmpty()) {
                return false;
            }

            Task task;
            try {
                task = taskService.move(workspaceId, candidate.get().id(), Phase.EXECUTING,
                    Actor.SYSTEM, AUTO_ASSIGN_REASON);
            } catch (TaskFactoryException e) {
                log.info("Could not dispatch task {}: {}", candidate.get().id(), e.getMessage());
                return false;
            }
            return startSession(task, workspace);
        });
    }

    private boolean isEligible(Task task) {
        return task.hasPlan()
            && !task.blocked()
            && !sessionRegistry.hasLiveSession(workspaceId, task.id());
    }

    private boolean startSession(Task task, Workspace workspace) {
        try (var ctx = LoggingContext.forTask(workspaceId, task.id())) {
            sessionRegistry.start(task, workspace, this::postOutcome);
            metrics.queueDispatched(false);
            log.info("Queue started task {} ({})", task.id(), task.title());
            return true;
        } catch (AlreadyRunningException e) {
            log.info("Task {} already has a session, retrying the queue in {}", task.id(), startRetryDelay);
            scheduleRetry();
            return false;
        } catch (ExecutionFailedException e) {
            recordStartFailure(task, e);
            return !breaker.isOpen();
        }
    }

    private void recordStartFailure(Task task, ExecutionFailedException e) {
        String error = e.getCause() != null && e.getCause().getMessage() != null
            ? e.getCause().getMessage()
            : e.getMessage();
        log.warn("Could not start task {}: {}", task.id(), error);
        markExecutionError(task.id(), error);
        activityService.systemNote(workspaceId, task.id(), "Agent execution could not start: " + error);
        feedBreaker(error);
    }

    private void scheduleRetry() {
        try {
            timer.schedule(this::kick, startRetryDelay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Retry timer is shut down, not rescheduling workspace {}", workspaceId);
        }
    }

    private void postOutcome(SessionSnapshot session, ExecutionResult result) {
        post(() -> handleOutcome(session, result));
    }

    private void handleOutcome(SessionSnapshot session, ExecutionResult result) {
        String taskId = session.taskId();
        try (var ctx = LoggingContext.forSession(workspaceId, taskId, session.sessionId())) {
            Optional<Task> current = taskRepository.findById(workspaceId, taskId);
            if (!sessionRegistry.isLatestAttempt(session)) {
                log.debug("Ignoring outcome of superseded attempt {} of task {}", session.attemptId(), taskId);
            } else if (current.isEmpty() || current.get().phase() != Phase.EXECUTING) {
                log.debug("Task {} left executing before its outcome arrived", taskId);
            } else if (result.success()) {
                breaker.recordSuccess();
                taskService.move(workspaceId, taskId, Phase.COMPLETE, Actor.SYSTEM, COMPLETED_REASON);
            } else {
                String error = result.errorMessage() != null ? result.errorMessage() : "Agent execution failed";
                markExecutionError(taskId, error);
                activityService.systemNote(workspaceId, taskId, "Agent execution failed: " + error);
                feedBreaker(error);
            }
        } catch (TaskFactoryException e) {
            log.warn("Could not apply outcome of task {}: {}", taskId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error handling outcome of task {}", taskId, e);
        }
        broadcastStatus();
        kick();
    }

    private void markExecutionError(String taskId, String error) {
        try {
            workspaceLocks.withLock(workspaceId, () -> {
                Task failed = taskRepository.modify(workspaceId, taskId, t -> t.toBuilder()
                    .executionError(error)
                    .updatedAt(clock.instant())
                    .build());
                broadcastHub.broadcast(workspaceId, EventType.TASK_UPDATED, taskId, Map.of("task", failed));
            });
        } catch (NotFoundException e) {
            log.debug("Task {} deleted before its error could be recorded", taskId);
        }
    }

    private void feedBreaker(String error) {
        breaker.recordFailure(error).ifPresent(category -> {
            metrics.breakerTripped(category.wireName());
            BreakerStatus status = breaker.status();
            activityService.systemNote(workspaceId, null, String.format(
                "Execution breaker opened (%s). Queue dispatch paused until %s.", category.wireName(), status.retryAt()));
            broadcastStatus();
        });
    }

    private void broadcastStatus() {
        try {
            broadcastHub.broadcast(workspaceId, EventType.QUEUE_STATUS, null, Map.of("status", status()));
        } catch (RuntimeException e) {
            log.warn("Could not broadcast queue status for workspace {}: {}", workspaceId, e.getMessage());
        }
    }

    private Workspace workspace() {
        return workspaceRepository.findById(workspaceId)
            .orElseThrow(() -> new NotFoundException("Workspace", workspaceId));
    }
}

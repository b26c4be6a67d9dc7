package com.taskfactory.scheduler;

import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.config.TaskFactoryProperties;
import com.taskfactory.engine.config.WorkflowSettingsResolver;
import com.taskfactory.engine.lock.WorkspaceLocks;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import com.taskfactory.engine.queue.QueueKickCoordinator;
import com.taskfactory.engine.queue.QueueKickHandler;
import com.taskfactory.engine.service.TaskService;
import com.taskfactory.engine.session.SessionRegistry;
import com.taskfactory.engine.session.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Process-wide owner of the workspace queues.
 *
 * Responsibilities:
 * - Create a {@link QueueManager} per workspace on first kick
 * - Kick every queue on a safety poll, in case a kick was lost
 * - Start and stop queue processing on request
 * - Stop all queues on shutdown
 */
public class QueueCoordinator implements QueueKickHandler {

    private static final Logger log = LoggerFactory.getLogger(QueueCoordinator.class);

    private final TaskService taskService;
    private final TaskRepository taskRepository;
    private final WorkspaceRepository workspaceRepository;
    private final WorkflowSettingsResolver settingsResolver;
    private final WorkspaceLocks workspaceLocks;
    private final SessionRegistry sessionRegistry;
    private final ActivityService activityService;
    private final BroadcastHub broadcastHub;
    private final QueueKickCoordinator queueKickCoordinator;
    private final TaskFactoryMetrics metrics;
    private final TaskFactoryProperties properties;
    private final Clock clock;

    private final Map<String, QueueManager> managers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timer;
    private volatile boolean running = false;

    public QueueCoordinator(
            TaskService taskService,
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            WorkflowSettingsResolver settingsResolver,
            WorkspaceLocks workspaceLocks,
            SessionRegistry sessionRegistry,
            ActivityService activityService,
            BroadcastHub broadcastHub,
            QueueKickCoordinator queueKickCoordinator,
            TaskFactoryMetrics metrics,
            TaskFactoryProperties properties,
            Clock clock) {
        this.taskService = taskService;
        this.taskRepository = taskRepository;
        this.workspaceRepository = workspaceRepository;
        this.settingsResolver = settingsResolver;
        this.workspaceLocks = workspaceLocks;
        this.sessionRegistry = sessionRegistry;
        this.activityService = activityService;
        this.broadcastHub = broadcastHub;
        this.queueKickCoordinator = queueKickCoordinator;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "queue-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Register as the kick handler and start the safety poll.
     */
    public void start() {
        if (running) {
            log.warn("Queue coordinator already running");
            return;
        }
        running = true;
        queueKickCoordinator.registerHandler(this);

        Duration pollInterval = properties.getQueue().getPollInterval();
        timer.scheduleWithFixedDelay(
            this::kickAll,
            pollInterval.toMillis(),
            pollInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("Queue coordinator started, safety poll every {}", pollInterval);
    }

    @Override
    public void kick(String workspaceId) {
        if (!running) {
            return;
        }
        if (workspaceRepository.findById(workspaceId).isEmpty()) {
            log.debug("Ignoring kick for unknown workspace {}", workspaceId);
            return;
        }
        manager(workspaceId).kick();
    }

    public void kickAll() {
        try {
            workspaceRepository.findAll().forEach(workspace -> kick(workspace.id()));
        } catch (RuntimeException e) {
            log.error("Safety poll failed", e);
        }
    }

    /**
     * Kick every workspace whose auto-execute resolves on. Called once at startup.
     *
     * @return number of workspaces kicked
     */
    public int initialize() {
        int kicked = 0;
        for (Workspace workspace : workspaceRepository.findAll()) {
            if (settingsResolver.resolve(workspace.id()).autoExecute()) {
                kick(workspace.id());
                kicked++;
            }
        }
        log.info("Initialized queues, {} of {} workspaces active", kicked, workspaceRepository.findAll().size());
        return kicked;
    }

    public SessionSnapshot executeNow(String workspaceId, String taskId) {
        requireWorkspace(workspaceId);
        return manager(workspaceId).executeNow(taskId);
    }

    public QueueStatus status(String workspaceId) {
        requireWorkspace(workspaceId);
        return manager(workspaceId).status();
    }

    /**
     * Turn queue processing on for a workspace. Clears an open execution
     * breaker, since a human has decided to resume.
     */
    public QueueStatus startQueueProcessing(String workspaceId) {
        requireWorkspace(workspaceId);
        workspaceRepository.updateConfig(workspaceId, config -> config
            .withQueueProcessingEnabled(true)
            .withAutoExecute(true));
        QueueManager manager = manager(workspaceId);
        if (manager.breaker().clear()) {
            activityService.systemNote(workspaceId, null, "Execution breaker cleared. Queue resumed.");
        }
        log.info("Queue processing started for workspace {}", workspaceId);
        broadcastAutomation(workspaceId);
        manager.kick();
        return broadcastStatus(workspaceId, manager);
    }

    /**
     * Turn queue processing off. Running sessions are left to finish.
     */
    public QueueStatus stopQueueProcessing(String workspaceId) {
        requireWorkspace(workspaceId);
        workspaceRepository.updateConfig(workspaceId, config -> config
            .withQueueProcessingEnabled(false)
            .withAutoExecute(false));
        log.info("Queue processing stopped for workspace {}", workspaceId);
        broadcastAutomation(workspaceId);
        return broadcastStatus(workspaceId, manager(workspaceId));
    }

    /**
     * Open breakers by workspace, for health reporting.
     */
    public Map<String, BreakerStatus> openBreakers() {
        return managers.entrySet().stream()
            .filter(e -> e.getValue().breaker().isOpen())
            .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().breaker().status()));
    }

    /**
     * Wait for a workspace queue to go idle.
     */
    public boolean flush(String workspaceId, Duration timeout) {
        QueueManager manager = managers.get(workspaceId);
        return manager == null || manager.flush(timeout);
    }

    @Override
    public void release(String workspaceId) {
        QueueManager manager = managers.remove(workspaceId);
        if (manager != null) {
            manager.stop();
        }
    }

    @Override
    public void shutdown() {
        running = false;
        timer.shutdownNow();
        List.copyOf(managers.keySet()).forEach(this::release);
        log.info("Queue coordinator stopped");
    }

    public int managerCount() {
        return managers.size();
    }

    // ========== Internal Methods ==========

    private QueueManager manager(String workspaceId) {
        return managers.computeIfAbsent(workspaceId, this::createManager);
    }

    private QueueManager createManager(String workspaceId) {
        TaskFactoryProperties.Breaker breakerConfig = properties.getBreaker();
        ExecutionBreaker breaker = new ExecutionBreaker(
            workspaceId,
            breakerConfig.isEnabled(),
            breakerConfig.getThreshold(),
            breakerConfig.getBurstWindow(),
            breakerConfig.getCooldown(),
            clock);
        log.debug("Creating queue manager for workspace {}", workspaceId);
        return new QueueManager(
            workspaceId, taskService, taskRepository, workspaceRepository, settingsResolver,
            workspaceLocks, sessionRegistry, activityService, broadcastHub, breaker, metrics,
            timer, properties.getQueue().getStartRetryDelay(), clock);
    }

    private QueueStatus broadcastStatus(String workspaceId, QueueManager manager) {
        QueueStatus status = manager.status();
        broadcastHub.broadcast(workspaceId, EventType.QUEUE_STATUS, null, Map.of("status", status));
        return status;
    }

    private void broadcastAutomation(String workspaceId) {
        var settings = settingsResolver.resolve(workspaceId);
        broadcastHub.broadcast(workspaceId, EventType.WORKSPACE_AUTOMATION_UPDATED, null, Map.of(
            "promoteOnPlanReady", settings.promoteOnPlanReady(),
            "autoExecute", settings.autoExecute()));
    }

    private void requireWorkspace(String workspaceId) {
        if (workspaceRepository.findById(workspaceId).isEmpty()) {
            throw new NotFoundException("Workspace", workspaceId);
        }
    }
}

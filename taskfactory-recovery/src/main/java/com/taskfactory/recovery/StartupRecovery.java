package com.taskfactory.recovery;

import com.taskfactory.core.exception.TaskFactoryException;
import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.PlanningStatus;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.config.TaskFactoryProperties;
import com.taskfactory.engine.logging.LoggingContext;
import com.taskfactory.engine.planning.PlanningService;
import com.taskfactory.engine.service.TaskService;
import com.taskfactory.engine.session.SessionRegistry;
import com.taskfactory.scheduler.QueueCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts the board back in motion after a restart.
 *
 * Responsibilities:
 * - Resume plan generation that was cut off mid-flight
 * - Move executing tasks that lost their session back to ready
 * - Kick every workspace queue whose auto-execute is on
 *
 * Each task is recovered on its own; one failure never stops the pass.
 */
public class StartupRecovery {

    private static final Logger log = LoggerFactory.getLogger(StartupRecovery.class);

    static final String REQUEUE_REASON = "Requeued after restart";

    private final WorkspaceRepository workspaceRepository;
    private final TaskRepository taskRepository;
    private final TaskService taskService;
    private final PlanningService planningService;
    private final SessionRegistry sessionRegistry;
    private final ActivityService activityService;
    private final QueueCoordinator queueCoordinator;
    private final TaskFactoryProperties properties;

    public StartupRecovery(
            WorkspaceRepository workspaceRepository,
            TaskRepository taskRepository,
            TaskService taskService,
            PlanningService planningService,
            SessionRegistry sessionRegistry,
            ActivityService activityService,
            QueueCoordinator queueCoordinator,
            TaskFactoryProperties properties) {
        this.workspaceRepository = workspaceRepository;
        this.taskRepository = taskRepository;
        this.taskService = taskService;
        this.planningService = planningService;
        this.sessionRegistry = sessionRegistry;
        this.activityService = activityService;
        this.queueCoordinator = queueCoordinator;
        this.properties = properties;
    }

    public RecoveryReport recover() {
        log.info("Starting recovery pass");

        int resumed = resumePlanning();
        int requeued = properties.getRecovery().isRequeueStaleExecuting() ? requeueStaleExecutions() : 0;
        int kicked = queueCoordinator.initialize();

        RecoveryReport report = new RecoveryReport(resumed, requeued, kicked);
        log.info("Recovery complete: {} planning resumed, {} executions requeued, {} queues kicked",
            resumed, requeued, kicked);
        return report;
    }

    /**
     * Restart planning for tasks left RUNNING without a plan. The jobs are
     * not awaited.
     *
     * @return number of planning jobs started
     */
    int resumePlanning() {
        int resumed = 0;
        for (Workspace workspace : workspaceRepository.findAll()) {
            for (Task task : taskRepository.findByWorkspace(workspace.id())) {
                if (!needsPlanningResume(task)) {
                    continue;
                }
                try (var ctx = LoggingContext.forTask(workspace.id(), task.id())) {
                    planningService.resumePlanning(task).whenComplete((saved, error) -> {
                        if (error != null) {
                            log.warn("Resumed planning failed for task {}: {}", task.id(), error.getMessage());
                        }
                    });
                    resumed++;
                } catch (RuntimeException e) {
                    log.error("Could not resume planning for task {}", task.id(), e);
                }
            }
        }
        return resumed;
    }

    /**
     * Move executing tasks with no live session back to ready so they stop
     * holding executing capacity.
     *
     * @return number of tasks moved
     */
    int requeueStaleExecutions() {
        int requeued = 0;
        for (Workspace workspace : workspaceRepository.findAll()) {
            for (Task task : taskRepository.findByPhase(workspace.id(), Phase.EXECUTING)) {
                if (sessionRegistry.hasLiveSession(workspace.id(), task.id())) {
                    continue;
                }
                try (var ctx = LoggingContext.forTask(workspace.id(), task.id())) {
                    taskService.move(workspace.id(), task.id(), Phase.READY, Actor.SYSTEM, REQUEUE_REASON);
                    requeued++;
                    log.info("Requeued task {} that was executing before the restart", task.id());
                } catch (TaskFactoryException e) {
                    log.warn("Could not requeue task {}: {}", task.id(), e.getMessage());
                    activityService.systemNote(workspace.id(), task.id(),
                        "Could not requeue after restart: " + e.getMessage());
                }
            }
        }
        return requeued;
    }

    private static boolean needsPlanningResume(Task task) {
        return task.planningStatus() == PlanningStatus.RUNNING
            && !task.hasPlan()
            && task.phase() != Phase.COMPLETE
            && task.phase() != Phase.ARCHIVED;
    }
}

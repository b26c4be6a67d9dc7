package com.taskfactory.engine.test;

import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.PlanningStatus;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.model.TaskPlan;
import com.taskfactory.core.model.TaskPriority;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.automation.AutomationEngine;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.chat.ChatService;
import com.taskfactory.engine.config.TaskFactoryProperties;
import com.taskfactory.engine.config.WorkflowSettingsResolver;
import com.taskfactory.engine.coordinator.PhaseCoordinator;
import com.taskfactory.engine.coordinator.WorkspaceCoordinator;
import com.taskfactory.engine.lock.WorkspaceLocks;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import com.taskfactory.engine.persistence.InMemoryActivityRepository;
import com.taskfactory.engine.persistence.InMemoryTaskRepository;
import com.taskfactory.engine.persistence.InMemoryWorkspaceRepository;
import com.taskfactory.engine.planning.PlanningService;
import com.taskfactory.engine.qa.QAChannel;
import com.taskfactory.engine.queue.QueueKickCoordinator;
import com.taskfactory.engine.queue.QueueKickHandler;
import com.taskfactory.engine.service.NewTask;
import com.taskfactory.engine.session.SessionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The engine wired by hand, with an in-process agent and planner. Each test
 * builds a fresh one.
 */
public class EngineFixture {

    public final TimeController clock = TimeController.frozen();
    public final TaskFactoryProperties properties = new TaskFactoryProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final TaskFactoryMetrics metrics = new TaskFactoryMetrics(meterRegistry);

    public final InMemoryTaskRepository taskRepository = new InMemoryTaskRepository();
    public final InMemoryWorkspaceRepository workspaceRepository = new InMemoryWorkspaceRepository();
    public final InMemoryActivityRepository activityRepository = new InMemoryActivityRepository();

    public final FakeExecutionCollaborator agent = new FakeExecutionCollaborator();
    public final StubPlanner planner = new StubPlanner();

    public final WorkspaceLocks workspaceLocks = new WorkspaceLocks();
    public final QueueKickCoordinator queueKickCoordinator = new QueueKickCoordinator();
    public final WorkflowSettingsResolver settingsResolver =
        new WorkflowSettingsResolver(properties, workspaceRepository);
    public final BroadcastHub broadcastHub = new BroadcastHub(clock, metrics);
    public final ActivityService activityService = new ActivityService(activityRepository, broadcastHub);
    public final SessionRegistry sessionRegistry = new SessionRegistry(
        agent, taskRepository, broadcastHub, metrics, clock, Duration.ofSeconds(2));
    public final PhaseCoordinator phaseCoordinator = new PhaseCoordinator(
        taskRepository, workspaceRepository, activityRepository, settingsResolver, workspaceLocks,
        sessionRegistry, activityService, broadcastHub, queueKickCoordinator, metrics, clock);
    public final QAChannel qaChannel = new QAChannel(broadcastHub, metrics);
    public final WorkspaceCoordinator workspaceCoordinator = new WorkspaceCoordinator(
        workspaceRepository, taskRepository, activityRepository, workspaceLocks, sessionRegistry,
        qaChannel, broadcastHub, queueKickCoordinator);
    public final AutomationEngine automationEngine = new AutomationEngine(
        phaseCoordinator, taskRepository, workspaceRepository, settingsResolver, broadcastHub, queueKickCoordinator);
    public final PlanningService planningService = new PlanningService(
        taskRepository, workspaceRepository, planner, automationEngine, activityService, broadcastHub,
        workspaceLocks, properties, clock);
    public final ChatService chatService = new ChatService(
        taskRepository, workspaceRepository, sessionRegistry, activityService);

    /**
     * Register a kick handler that only records which workspaces were kicked.
     */
    public List<String> recordKicks() {
        List<String> kicks = new CopyOnWriteArrayList<>();
        queueKickCoordinator.registerHandler(new QueueKickHandler() {
            @Override
            public void kick(String workspaceId) {
                kicks.add(workspaceId);
            }

            @Override
            public void release(String workspaceId) {
            }

            @Override
            public void shutdown() {
            }
        });
        return kicks;
    }

    public Workspace workspace(String name) {
        return workspaceCoordinator.createWorkspace(name, "/work/" + name);
    }

    public Task task(Workspace workspace, String title) {
        return phaseCoordinator.createTask(workspace.id(),
            new NewTask(title, title + " description", TaskPriority.NORMAL, List.of("it works")));
    }

    /**
     * A backlog task that already carries a plan.
     */
    public Task plannedTask(Workspace workspace, String title) {
        Task task = task(workspace, title);
        return taskRepository.modify(workspace.id(), task.id(), t -> t.toBuilder()
            .plan(samplePlan())
            .planningStatus(PlanningStatus.COMPLETED)
            .build());
    }

    public Task readyTask(Workspace workspace, String title) {
        Task task = plannedTask(workspace, title);
        return phaseCoordinator.move(workspace.id(), task.id(), Phase.READY, Actor.USER, "ready");
    }

    public Task reload(Task task) {
        return taskRepository.findById(task.workspaceId(), task.id()).orElseThrow();
    }

    public static TaskPlan samplePlan() {
        return new TaskPlan("Implement the change", List.of("edit", "test"), List.of("tests pass"), List.of(), null);
    }
}

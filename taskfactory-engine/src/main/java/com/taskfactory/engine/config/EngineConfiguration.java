package com.taskfactory.engine.config;

import com.taskfactory.agent.ExecutionCollaborator;
import com.taskfactory.agent.PlanningCollaborator;
import com.taskfactory.core.repository.ActivityRepository;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.automation.AutomationEngine;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.chat.ChatService;
import com.taskfactory.engine.coordinator.PhaseCoordinator;
import com.taskfactory.engine.coordinator.WorkspaceCoordinator;
import com.taskfactory.engine.lock.WorkspaceLocks;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import com.taskfactory.engine.planning.PlanningService;
import com.taskfactory.engine.qa.QAChannel;
import com.taskfactory.engine.queue.QueueKickCoordinator;
import com.taskfactory.engine.service.TaskService;
import com.taskfactory.engine.service.WorkspaceService;
import com.taskfactory.engine.session.SessionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engine's coordinators. The agent collaborators are supplied by
 * the application.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkspaceLocks workspaceLocks() {
        return new WorkspaceLocks();
    }

    @Bean
    public QueueKickCoordinator queueKickCoordinator() {
        return new QueueKickCoordinator();
    }

    @Bean
    public WorkflowSettingsResolver workflowSettingsResolver(
            TaskFactoryProperties properties, WorkspaceRepository workspaceRepository) {
        return new WorkflowSettingsResolver(properties, workspaceRepository);
    }

    @Bean
    public BroadcastHub broadcastHub(Clock clock, TaskFactoryMetrics metrics) {
        return new BroadcastHub(clock, metrics);
    }

    @Bean
    public ActivityService activityService(ActivityRepository activityRepository, BroadcastHub broadcastHub) {
        return new ActivityService(activityRepository, broadcastHub);
    }

    @Bean
    public SessionRegistry sessionRegistry(
            ExecutionCollaborator executionCollaborator,
            TaskRepository taskRepository,
            BroadcastHub broadcastHub,
            TaskFactoryMetrics metrics,
            Clock clock,
            TaskFactoryProperties properties) {
        return new SessionRegistry(executionCollaborator, taskRepository, broadcastHub, metrics, clock,
            properties.getSession().getStopTimeout());
    }

    @Bean
    public PhaseCoordinator phaseCoordinator(
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            ActivityRepository activityRepository,
            WorkflowSettingsResolver settingsResolver,
            WorkspaceLocks workspaceLocks,
            SessionRegistry sessionRegistry,
            ActivityService activityService,
            BroadcastHub broadcastHub,
            QueueKickCoordinator queueKickCoordinator,
            TaskFactoryMetrics metrics,
            Clock clock) {
        return new PhaseCoordinator(taskRepository, workspaceRepository, activityRepository, settingsResolver,
            workspaceLocks, sessionRegistry, activityService, broadcastHub, queueKickCoordinator, metrics, clock);
    }

    @Bean
    public QAChannel qaChannel(BroadcastHub broadcastHub, TaskFactoryMetrics metrics) {
        return new QAChannel(broadcastHub, metrics);
    }

    @Bean
    public WorkspaceCoordinator workspaceCoordinator(
            WorkspaceRepository workspaceRepository,
            TaskRepository taskRepository,
            ActivityRepository activityRepository,
            WorkspaceLocks workspaceLocks,
            SessionRegistry sessionRegistry,
            QAChannel qaChannel,
            BroadcastHub broadcastHub,
            QueueKickCoordinator queueKickCoordinator) {
        return new WorkspaceCoordinator(workspaceRepository, taskRepository, activityRepository, workspaceLocks,
            sessionRegistry, qaChannel, broadcastHub, queueKickCoordinator);
    }

    @Bean
    public AutomationEngine automationEngine(
            TaskService taskService,
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            WorkflowSettingsResolver settingsResolver,
            BroadcastHub broadcastHub,
            QueueKickCoordinator queueKickCoordinator) {
        return new AutomationEngine(taskService, taskRepository, workspaceRepository, settingsResolver,
            broadcastHub, queueKickCoordinator);
    }

    @Bean
    public PlanningService planningService(
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            PlanningCollaborator planningCollaborator,
            AutomationEngine automationEngine,
            ActivityService activityService,
            BroadcastHub broadcastHub,
            WorkspaceLocks workspaceLocks,
            TaskFactoryProperties properties,
            Clock clock) {
        return new PlanningService(taskRepository, workspaceRepository, planningCollaborator, automationEngine,
            activityService, broadcastHub, workspaceLocks, properties, clock);
    }

    @Bean
    public ChatService chatService(
            TaskRepository taskRepository,
            WorkspaceRepository workspaceRepository,
            SessionRegistry sessionRegistry,
            ActivityService activityService) {
        return new ChatService(taskRepository, workspaceRepository, sessionRegistry, activityService);
    }
}

package com.taskfactory.scheduler;

import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.config.TaskFactoryProperties;
import com.taskfactory.engine.config.WorkflowSettingsResolver;
import com.taskfactory.engine.lock.WorkspaceLocks;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import com.taskfactory.engine.queue.QueueKickCoordinator;
import com.taskfactory.engine.service.TaskService;
import com.taskfactory.engine.session.SessionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the queue coordinator. Shutdown goes through the kick coordinator,
 * so the bean has no destroy method of its own.
 */
@Configuration
public class SchedulerConfiguration {

    @Bean(destroyMethod = "")
    public QueueCoordinator queueCoordinator(
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
        QueueCoordinator coordinator = new QueueCoordinator(taskService, taskRepository, workspaceRepository,
            settingsResolver, workspaceLocks, sessionRegistry, activityService, broadcastHub, queueKickCoordinator,
            metrics, properties, clock);
        coordinator.start();
        return coordinator;
    }
}

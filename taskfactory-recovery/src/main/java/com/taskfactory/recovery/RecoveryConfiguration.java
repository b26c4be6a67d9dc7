package com.taskfactory.recovery;

import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.activity.ActivityService;
import com.taskfactory.engine.config.TaskFactoryProperties;
import com.taskfactory.engine.planning.PlanningService;
import com.taskfactory.engine.service.TaskService;
import com.taskfactory.engine.session.SessionRegistry;
import com.taskfactory.scheduler.QueueCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Runs startup recovery once the application is ready to serve.
 */
@Configuration
public class RecoveryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RecoveryConfiguration.class);

    @Bean
    public StartupRecovery startupRecovery(
            WorkspaceRepository workspaceRepository,
            TaskRepository taskRepository,
            TaskService taskService,
            PlanningService planningService,
            SessionRegistry sessionRegistry,
            ActivityService activityService,
            QueueCoordinator queueCoordinator,
            TaskFactoryProperties properties) {
        return new StartupRecovery(workspaceRepository, taskRepository, taskService, planningService,
            sessionRegistry, activityService, queueCoordinator, properties);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        try {
            event.getApplicationContext().getBean(StartupRecovery.class).recover();
        } catch (RuntimeException e) {
            log.error("Startup recovery failed", e);
        }
    }
}

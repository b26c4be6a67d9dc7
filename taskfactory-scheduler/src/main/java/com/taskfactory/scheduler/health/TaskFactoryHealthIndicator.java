package com.taskfactory.scheduler.health;

import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.qa.QAChannel;
import com.taskfactory.engine.session.SessionRegistry;
import com.taskfactory.engine.session.SessionSnapshot;
import com.taskfactory.scheduler.BreakerStatus;
import com.taskfactory.scheduler.QueueCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Custom health indicator for the task factory.
 * Reports:
 * - Board population per phase across workspaces
 * - Live agent sessions and connected observers
 * - Pending Q&A requests
 * - Open execution breakers (reported, but the service stays UP)
 */
@Component
public class TaskFactoryHealthIndicator implements HealthIndicator {

    private final WorkspaceRepository workspaceRepository;
    private final TaskRepository taskRepository;
    private final SessionRegistry sessionRegistry;
    private final BroadcastHub broadcastHub;
    private final QAChannel qaChannel;
    private final QueueCoordinator queueCoordinator;

    public TaskFactoryHealthIndicator(
            WorkspaceRepository workspaceRepository,
            TaskRepository taskRepository,
            SessionRegistry sessionRegistry,
            BroadcastHub broadcastHub,
            QAChannel qaChannel,
            QueueCoordinator queueCoordinator) {
        this.workspaceRepository = workspaceRepository;
        this.taskRepository = taskRepository;
        this.sessionRegistry = sessionRegistry;
        this.broadcastHub = broadcastHub;
        this.qaChannel = qaChannel;
        this.queueCoordinator = queueCoordinator;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            checkBoard(details);

            checkSessions(details);
            details.put("observers", broadcastHub.connectedObservers());
            details.put("pendingQuestions", qaChannel.pendingCount());

            Map<String, BreakerStatus> openBreakers = queueCoordinator.openBreakers();
            details.put("openBreakers", openBreakers);
            if (!openBreakers.isEmpty()) {
                details.put("breakerWarning", "Queue dispatch paused in " + openBreakers.size() + " workspace(s)");
            }

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private void checkSessions(Map<String, Object> details) {
        List<SessionSnapshot> sessions = sessionRegistry.activeSessions();
        details.put("liveSessions", sessions.size());
        details.put("sessionsByPurpose", sessions.stream()
            .collect(Collectors.groupingBy(s -> s.purpose().name().toLowerCase(), Collectors.counting())));
    }

    private void checkBoard(Map<String, Object> details) {
        Map<Phase, Integer> tasksByPhase = new EnumMap<>(Phase.class);
        int workspaces = 0;
        for (Workspace workspace : workspaceRepository.findAll()) {
            workspaces++;
            taskRepository.countByPhase(workspace.id())
                .forEach((phase, count) -> tasksByPhase.merge(phase, count, Integer::sum));
        }
        details.put("workspaces", workspaces);
        details.put("tasks", tasksByPhase);
    }
}

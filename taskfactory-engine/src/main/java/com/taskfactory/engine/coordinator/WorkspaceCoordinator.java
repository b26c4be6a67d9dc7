package com.taskfactory.engine.coordinator;

import com.taskfactory.core.admission.AdmissionController;
import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.repository.ActivityRepository;
import com.taskfactory.core.repository.TaskRepository;
import com.taskfactory.core.repository.WorkspaceRepository;
import com.taskfactory.engine.broadcast.BroadcastHub;
import com.taskfactory.engine.lock.WorkspaceLocks;
import com.taskfactory.engine.qa.QAChannel;
import com.taskfactory.engine.queue.QueueKickCoordinator;
import com.taskfactory.engine.service.WorkspaceService;
import com.taskfactory.engine.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Coordinator for workspace lifecycle.
 */
public class WorkspaceCoordinator implements WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceCoordinator.class);

    private final WorkspaceRepository workspaceRepository;
    private final TaskRepository taskRepository;
    private final ActivityRepository activityRepository;
    private final WorkspaceLocks workspaceLocks;
    private final SessionRegistry sessionRegistry;
    private final QAChannel qaChannel;
    private final BroadcastHub broadcastHub;
    private final QueueKickCoordinator queueKickCoordinator;

    public WorkspaceCoordinator(
            WorkspaceRepository workspaceRepository,
            TaskRepository taskRepository,
            ActivityRepository activityRepository,
            WorkspaceLocks workspaceLocks,
            SessionRegistry sessionRegistry,
            QAChannel qaChannel,
            BroadcastHub broadcastHub,
            QueueKickCoordinator queueKickCoordinator) {
        this.workspaceRepository = workspaceRepository;
        this.taskRepository = taskRepository;
        this.activityRepository = activityRepository;
        this.workspaceLocks = workspaceLocks;
        this.sessionRegistry = sessionRegistry;
        this.qaChannel = qaChannel;
        this.broadcastHub = broadcastHub;
        this.queueKickCoordinator = queueKickCoordinator;
    }

    @Override
    public Workspace createWorkspace(String name, String rootPath) {
        Workspace workspace = Workspace.create(name, rootPath);
        workspaceRepository.save(workspace);
        log.info("Created workspace {} ({}) at {}", workspace.id(), name, rootPath);
        return workspace;
    }

    @Override
    public Workspace getWorkspace(String workspaceId) {
        return workspaceRepository.findById(workspaceId)
            .orElseThrow(() -> new NotFoundException("Workspace", workspaceId));
    }

    @Override
    public List<Workspace> listWorkspaces() {
        return workspaceRepository.findAll();
    }

    @Override
    public Workspace updateWipLimits(String workspaceId, Map<Phase, Integer> wipLimits) {
        AdmissionController.validateLimits(wipLimits);
        Map<Phase, Integer> overrides = new EnumMap<>(Phase.class);
        wipLimits.forEach((phase, limit) -> {
            if (limit != null) {
                overrides.put(phase, limit);
            }
        });

        Workspace updated = workspaceRepository.updateConfig(workspaceId, config -> config.withWipLimits(overrides));
        log.info("WIP overrides for workspace {} set to {}", workspaceId, overrides);

        broadcastHub.broadcast(workspaceId, EventType.WORKSPACE_UPDATED, null, Map.of("workspace", updated));
        // A raised executing limit may free a slot.
        queueKickCoordinator.requestKick(workspaceId);
        return updated;
    }

    @Override
    public void deleteWorkspace(String workspaceId) {
        getWorkspace(workspaceId);

        queueKickCoordinator.releaseWorkspace(workspaceId);
        workspaceLocks.withLock(workspaceId, () -> {
            int stopped = sessionRegistry.stopWorkspace(workspaceId);
            qaChannel.abortWorkspace(workspaceId);
            int removed = taskRepository.deleteByWorkspace(workspaceId);
            activityRepository.deleteByWorkspace(workspaceId);
            workspaceRepository.delete(workspaceId);
            log.info("Deleted workspace {}: {} tasks removed, {} sessions stopped", workspaceId, removed, stopped);
        });

        broadcastHub.broadcast(workspaceId, EventType.WORKSPACE_DELETED, null, Map.of("workspaceId", workspaceId));
        broadcastHub.dropWorkspace(workspaceId);
        workspaceLocks.release(workspaceId);
    }
}

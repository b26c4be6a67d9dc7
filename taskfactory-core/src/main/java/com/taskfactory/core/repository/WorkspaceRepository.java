package com.taskfactory.core.repository;

import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.model.WorkspaceConfig;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository for Workspace persistence.
 */
public interface WorkspaceRepository {

    void save(Workspace workspace);

    Optional<Workspace> findById(String workspaceId);

    List<Workspace> findAll();

    /**
     * Atomically replace a workspace's configuration.
     *
     * @param workspaceId The workspace
     * @param modifier Produces the new configuration from the current one
     * @return The updated workspace
     * @throws com.taskfactory.core.exception.NotFoundException if the workspace does not exist
     */
    Workspace updateConfig(String workspaceId, UnaryOperator<WorkspaceConfig> modifier);

    boolean delete(String workspaceId);
}

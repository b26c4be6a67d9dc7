package com.taskfactory.engine.service;

import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Workspace;

import java.util.List;
import java.util.Map;

/**
 * Service for workspace lifecycle and per-workspace WIP overrides.
 */
public interface WorkspaceService {

    Workspace createWorkspace(String name, String rootPath);

    /**
     * @throws com.taskfactory.core.exception.NotFoundException if the workspace does not exist
     */
    Workspace getWorkspace(String workspaceId);

    List<Workspace> listWorkspaces();

    /**
     * Replace the workspace's WIP overrides. A null value removes the
     * override for that phase so the global default applies.
     *
     * @param workspaceId The workspace
     * @param wipLimits Overrides by phase
     * @return The updated workspace
     * @throws com.taskfactory.core.exception.ConfigurationValidationException if a limit is negative
     */
    Workspace updateWipLimits(String workspaceId, Map<Phase, Integer> wipLimits);

    /**
     * Delete a workspace: stop its sessions and queue, then remove its tasks.
     *
     * @param workspaceId The workspace
     */
    void deleteWorkspace(String workspaceId);
}

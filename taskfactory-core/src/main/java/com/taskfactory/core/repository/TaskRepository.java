package com.taskfactory.core.repository;

import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Task;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository for Task persistence, namespaced by workspace.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task The task to save
     */
    void save(Task task);

    /**
     * Atomic read-modify-write of one task. The function sees the latest stored
     * value and may be retried, so it must be free of side effects.
     *
     * @param workspaceId The workspace
     * @param taskId The task ID
     * @param modifier Produces the new value from the current one
     * @return The stored task with its version bumped
     * @throws com.taskfactory.core.exception.NotFoundException if the task does not exist
     */
    Task modify(String workspaceId, String taskId, UnaryOperator<Task> modifier);

    /**
     * Find a task by ID.
     *
     * @param workspaceId The workspace
     * @param taskId The task ID
     * @return The task if found
     */
    Optional<Task> findById(String workspaceId, String taskId);

    /**
     * Find all tasks of a workspace.
     *
     * @param workspaceId The workspace
     * @return Tasks sorted by phase, then order
     */
    List<Task> findByWorkspace(String workspaceId);

    /**
     * Find tasks in one phase.
     *
     * @param workspaceId The workspace
     * @param phase The phase
     * @return Tasks sorted by order, earliest first
     */
    List<Task> findByPhase(String workspaceId, Phase phase);

    /**
     * Count tasks per phase.
     *
     * @param workspaceId The workspace
     * @return Population of each phase; phases with no tasks may be absent
     */
    Map<Phase, Integer> countByPhase(String workspaceId);

    /**
     * Highest order key in a phase.
     *
     * @param workspaceId The workspace
     * @param phase The phase
     * @return The maximum order, or -1 if the phase is empty
     */
    long maxOrder(String workspaceId, Phase phase);

    /**
     * Delete a task.
     *
     * @param workspaceId The workspace
     * @param taskId The task ID
     * @return true if a task was removed
     */
    boolean delete(String workspaceId, String taskId);

    /**
     * Delete every task of a workspace.
     *
     * @param workspaceId The workspace
     * @return Number of tasks removed
     */
    int deleteByWorkspace(String workspaceId);

    /**
     * Next task ID for a workspace, e.g. TASK-7.
     *
     * @param workspaceId The workspace
     * @return A fresh ID
     */
    String nextTaskId(String workspaceId);
}

package com.taskfactory.engine.service;

import com.taskfactory.core.model.Actor;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Task;

import java.util.List;

/**
 * Service for the task board: creation, field edits and phase movement.
 */
public interface TaskService {

    /**
     * Create a task at the end of the backlog.
     *
     * @param workspaceId The workspace
     * @param newTask The task fields
     * @return The created task
     * @throws com.taskfactory.core.exception.NotFoundException if the workspace does not exist
     */
    Task createTask(String workspaceId, NewTask newTask);

    /**
     * Apply a partial field update.
     *
     * @param workspaceId The workspace
     * @param taskId The task ID
     * @param update Fields to change
     * @return The updated task
     */
    Task updateTask(String workspaceId, String taskId, TaskUpdate update);

    /**
     * Delete a task, stopping its session first.
     *
     * @param workspaceId The workspace
     * @param taskId The task ID
     */
    void deleteTask(String workspaceId, String taskId);

    /**
     * @throws com.taskfactory.core.exception.NotFoundException if the task does not exist
     */
    Task getTask(String workspaceId, String taskId);

    /**
     * List tasks of a workspace.
     *
     * @param workspaceId The workspace
     * @param phase Only this phase, or null for all
     * @return Tasks in board order
     */
    List<Task> listTasks(String workspaceId, Phase phase);

    /**
     * Move a task to another phase.
     * A move to the phase the task already sits in returns it unchanged.
     *
     * @param workspaceId The workspace
     * @param taskId The task ID
     * @param targetPhase The phase to enter
     * @param actor Who asked for the move
     * @param reason Free-text reason recorded in the history
     * @return The moved task
     * @throws com.taskfactory.core.exception.InvalidTransitionException if the task may not enter the phase
     * @throws com.taskfactory.core.exception.CapacityExceededException if the phase is at its WIP limit
     */
    Task move(String workspaceId, String taskId, Phase targetPhase, Actor actor, String reason);

    /**
     * Reorder tasks within one phase. Unlisted tasks of the phase keep their
     * relative order after the listed ones.
     *
     * @param workspaceId The workspace
     * @param phase The phase
     * @param orderedTaskIds Task IDs in their new order
     * @return The phase's tasks in their new order
     * @throws com.taskfactory.core.exception.InvalidTransitionException if an ID is unknown or in another phase
     */
    List<Task> reorder(String workspaceId, Phase phase, List<String> orderedTaskIds);
}

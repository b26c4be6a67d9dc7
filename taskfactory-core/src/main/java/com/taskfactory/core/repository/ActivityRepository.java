package com.taskfactory.core.repository;

import com.taskfactory.core.model.ActivityEntry;

import java.util.List;

/**
 * Append-only store of activity entries.
 */
public interface ActivityRepository {

    /**
     * Append an entry.
     *
     * @param entry The entry
     */
    void append(ActivityEntry entry);

    /**
     * Entries for one task in append order.
     *
     * @param workspaceId The workspace
     * @param taskId The task ID
     * @param limit Maximum number of most recent entries
     * @return Entries, oldest first
     */
    List<ActivityEntry> findByTask(String workspaceId, String taskId, int limit);

    /**
     * Entries for a whole workspace in append order.
     *
     * @param workspaceId The workspace
     * @param limit Maximum number of most recent entries
     * @return Entries, oldest first
     */
    List<ActivityEntry> findByWorkspace(String workspaceId, int limit);

    void deleteByTask(String workspaceId, String taskId);

    void deleteByWorkspace(String workspaceId);
}

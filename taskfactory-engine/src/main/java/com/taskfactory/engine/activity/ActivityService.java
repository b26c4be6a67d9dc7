package com.taskfactory.engine.activity;

import com.taskfactory.core.model.ActivityEntry;
import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.repository.ActivityRepository;
import com.taskfactory.engine.broadcast.BroadcastHub;

import java.util.List;
import java.util.Map;

/**
 * Writes the per-task activity feed and pushes every entry to observers.
 */
public class ActivityService {

    public static final int DEFAULT_PAGE_SIZE = 200;

    private final ActivityRepository activityRepository;
    private final BroadcastHub broadcastHub;

    public ActivityService(ActivityRepository activityRepository, BroadcastHub broadcastHub) {
        this.activityRepository = activityRepository;
        this.broadcastHub = broadcastHub;
    }

    public ActivityEntry systemNote(String workspaceId, String taskId, String content) {
        return systemNote(workspaceId, taskId, content, Map.of());
    }

    public ActivityEntry systemNote(String workspaceId, String taskId, String content, Map<String, Object> metadata) {
        return append(ActivityEntry.systemEvent(workspaceId, taskId, content, metadata));
    }

    /**
     * @param role "user" or "agent"
     */
    public ActivityEntry chatMessage(String workspaceId, String taskId, String role, String content) {
        return append(ActivityEntry.chatMessage(workspaceId, taskId, role, content));
    }

    /**
     * Marks the start of a new section in the feed, e.g. a fresh execution
     * attempt or a move back down the pipeline.
     */
    public ActivityEntry separator(String workspaceId, String taskId, Phase phase) {
        ActivityEntry entry = append(ActivityEntry.separator(workspaceId, taskId, phase));
        broadcastHub.broadcast(workspaceId, EventType.TASK_SEPARATOR, taskId,
            Map.of("phase", phase.wireName(), "entryId", entry.id()));
        return entry;
    }

    public List<ActivityEntry> forTask(String workspaceId, String taskId, int limit) {
        return activityRepository.findByTask(workspaceId, taskId, limit);
    }

    private ActivityEntry append(ActivityEntry entry) {
        activityRepository.append(entry);
        broadcastHub.broadcast(entry.workspaceId(), EventType.ACTIVITY_ENTRY, entry.taskId(), Map.of("entry", entry));
        return entry;
    }
}

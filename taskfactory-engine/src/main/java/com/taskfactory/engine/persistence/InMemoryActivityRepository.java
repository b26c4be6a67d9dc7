package com.taskfactory.engine.persistence;

import com.taskfactory.core.model.ActivityEntry;
import com.taskfactory.core.repository.ActivityRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ActivityRepository.
 * One append-only list per workspace.
 */
@Repository
public class InMemoryActivityRepository implements ActivityRepository {

    private final Map<String, CopyOnWriteArrayList<ActivityEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public void append(ActivityEntry entry) {
        entries.computeIfAbsent(entry.workspaceId(), ws -> new CopyOnWriteArrayList<>()).add(entry);
    }

    @Override
    public List<ActivityEntry> findByTask(String workspaceId, String taskId, int limit) {
        List<ActivityEntry> matching = entries.getOrDefault(workspaceId, new CopyOnWriteArrayList<>()).stream()
            .filter(e -> taskId.equals(e.taskId()))
            .collect(Collectors.toList());
        return tail(matching, limit);
    }

    @Override
    public List<ActivityEntry> findByWorkspace(String workspaceId, int limit) {
        return tail(List.copyOf(entries.getOrDefault(workspaceId, new CopyOnWriteArrayList<>())), limit);
    }

    @Override
    public void deleteByTask(String workspaceId, String taskId) {
        List<ActivityEntry> list = entries.get(workspaceId);
        if (list != null) {
            list.removeIf(e -> taskId.equals(e.taskId()));
        }
    }

    @Override
    public void deleteByWorkspace(String workspaceId) {
        entries.remove(workspaceId);
    }

    private static List<ActivityEntry> tail(List<ActivityEntry> list, int limit) {
        if (limit <= 0 || list.size() <= limit) {
            return list;
        }
        return list.subList(list.size() - limit, list.size());
    }
}

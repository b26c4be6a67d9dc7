package com.taskfactory.engine.persistence;

import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.Task;
import com.taskfactory.core.repository.TaskRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRepository.
 * Writes go through {@link ConcurrentHashMap#compute} so each one is atomic per task.
 */
@Repository
public class InMemoryTaskRepository implements TaskRepository {

    private static final Comparator<Task> BOARD_ORDER =
        Comparator.comparingInt((Task t) -> t.phase().pipelineIndex()).thenComparingLong(Task::order);

    private final Map<String, ConcurrentHashMap<String, Task>> tasksByWorkspace = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> idCounters = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        tasks(task.workspaceId()).put(task.id(), task);
    }

    @Override
    public Task modify(String workspaceId, String taskId, UnaryOperator<Task> modifier) {
        return tasks(workspaceId).compute(taskId, (id, current) -> {
            if (current == null) {
                throw new NotFoundException("Task", id);
            }
            return modifier.apply(current).withVersion(current.version() + 1);
        });
    }

    @Override
    public Optional<Task> findById(String workspaceId, String taskId) {
        Map<String, Task> tasks = tasksByWorkspace.get(workspaceId);
        return tasks == null ? Optional.empty() : Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findByWorkspace(String workspaceId) {
        return tasks(workspaceId).values().stream()
            .sorted(BOARD_ORDER)
            .collect(Collectors.toList());
    }

    @Override
    public List<Task> findByPhase(String workspaceId, Phase phase) {
        return tasks(workspaceId).values().stream()
            .filter(t -> t.phase() == phase)
            .sorted(Comparator.comparingLong(Task::order))
            .collect(Collectors.toList());
    }

    @Override
    public Map<Phase, Integer> countByPhase(String workspaceId) {
        Map<Phase, Integer> counts = new EnumMap<>(Phase.class);
        tasks(workspaceId).values().forEach(t -> counts.merge(t.phase(), 1, Integer::sum));
        return counts;
    }

    @Override
    public long maxOrder(String workspaceId, Phase phase) {
        return tasks(workspaceId).values().stream()
            .filter(t -> t.phase() == phase)
            .mapToLong(Task::order)
            .max()
            .orElse(-1L);
    }

    @Override
    public boolean delete(String workspaceId, String taskId) {
        Map<String, Task> tasks = tasksByWorkspace.get(workspaceId);
        return tasks != null && tasks.remove(taskId) != null;
    }

    @Override
    public int deleteByWorkspace(String workspaceId) {
        idCounters.remove(workspaceId);
        Map<String, Task> removed = tasksByWorkspace.remove(workspaceId);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public String nextTaskId(String workspaceId) {
        long next = idCounters.computeIfAbsent(workspaceId, ws -> new AtomicLong()).incrementAndGet();
        return "TASK-" + next;
    }

    private ConcurrentHashMap<String, Task> tasks(String workspaceId) {
        return tasksByWorkspace.computeIfAbsent(workspaceId, ws -> new ConcurrentHashMap<>());
    }
}

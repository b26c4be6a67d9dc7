package com.taskfactory.engine.persistence;

import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.model.Workspace;
import com.taskfactory.core.model.WorkspaceConfig;
import com.taskfactory.core.repository.WorkspaceRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkspaceRepository.
 */
@Repository
public class InMemoryWorkspaceRepository implements WorkspaceRepository {

    private final Map<String, Workspace> workspaces = new ConcurrentHashMap<>();

    @Override
    public void save(Workspace workspace) {
        workspaces.put(workspace.id(), workspace);
    }

    @Override
    public Optional<Workspace> findById(String workspaceId) {
        return Optional.ofNullable(workspaces.get(workspaceId));
    }

    @Override
    public List<Workspace> findAll() {
        return workspaces.values().stream()
            .sorted(Comparator.comparing(Workspace::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public Workspace updateConfig(String workspaceId, UnaryOperator<WorkspaceConfig> modifier) {
        return workspaces.compute(workspaceId, (id, current) -> {
            if (current == null) {
                throw new NotFoundException("Workspace", id);
            }
            return current.withConfig(modifier.apply(current.config()));
        });
    }

    @Override
    public boolean delete(String workspaceId) {
        return workspaces.remove(workspaceId) != null;
    }
}

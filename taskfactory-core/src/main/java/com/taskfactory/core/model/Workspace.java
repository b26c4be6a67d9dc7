package com.taskfactory.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A project root that owns a board of tasks.
 */
public record Workspace(
    String id,
    String name,
    String rootPath,
    WorkspaceConfig config,
    Instant createdAt
) {
    public Workspace {
        config = config != null ? config : WorkspaceConfig.empty();
    }

    public static Workspace create(String name, String rootPath) {
        return new Workspace(UUID.randomUUID().toString(), name, rootPath, WorkspaceConfig.empty(), Instant.now());
    }

    public Workspace withConfig(WorkspaceConfig newConfig) {
        return new Workspace(id, name, rootPath, newConfig, createdAt);
    }
}

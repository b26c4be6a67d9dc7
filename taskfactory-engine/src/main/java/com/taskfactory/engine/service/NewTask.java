package com.taskfactory.engine.service;

import com.taskfactory.core.model.TaskPriority;

import java.util.List;

/**
 * Fields supplied when creating a task. Tasks always start in backlog.
 */
public record NewTask(
    String title,
    String description,
    TaskPriority priority,
    List<String> acceptanceCriteria
) {
    public NewTask {
        acceptanceCriteria = acceptanceCriteria != null ? List.copyOf(acceptanceCriteria) : List.of();
    }
}

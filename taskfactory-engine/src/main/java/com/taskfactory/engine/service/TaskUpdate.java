package com.taskfactory.engine.service;

import com.taskfactory.core.model.AcceptanceCriterion;
import com.taskfactory.core.model.TaskPriority;

import java.util.List;
import java.util.Map;

/**
 * Partial field update. Null fields are left unchanged; phase and order are
 * never touched here.
 */
public record TaskUpdate(
    String title,
    String description,
    TaskPriority priority,
    List<AcceptanceCriterion> acceptanceCriteria,
    Map<String, Boolean> qualityChecks,
    Boolean blocked,
    String blockedReason
) {
    public static TaskUpdate blocked(boolean blocked, String reason) {
        return new TaskUpdate(null, null, null, null, null, blocked, reason);
    }
}

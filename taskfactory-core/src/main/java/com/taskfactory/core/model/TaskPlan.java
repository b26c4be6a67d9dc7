package com.taskfactory.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Plan produced by the planning collaborator. Content is opaque to scheduling;
 * only its presence matters for entering {@link Phase#EXECUTING}.
 */
public record TaskPlan(
    String goal,
    List<String> steps,
    List<String> validation,
    List<String> cleanup,
    Instant generatedAt
) {
    public TaskPlan {
        steps = steps != null ? List.copyOf(steps) : List.of();
        validation = validation != null ? List.copyOf(validation) : List.of();
        cleanup = cleanup != null ? List.copyOf(cleanup) : List.of();
    }
}

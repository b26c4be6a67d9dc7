package com.taskfactory.agent;

import com.taskfactory.core.model.TaskPlan;

import java.util.concurrent.CompletableFuture;

/**
 * Produces plans for tasks. A restart may interrupt a plan mid-flight.
 */
@FunctionalInterface
public interface PlanningCollaborator {

    /**
     * Generate a plan.
     *
     * @param request The task to plan, with guardrails
     * @return Completes with the plan, or exceptionally with an {@link AgentException}
     */
    CompletableFuture<TaskPlan> plan(PlanningRequest request);
}

package com.taskfactory.core.model;

/**
 * State of plan generation for a task.
 */
public enum PlanningStatus {
    /**
     * No plan has been requested.
     */
    NONE,

    /**
     * The planning collaborator is working. If the process restarts while a
     * task sits here without a plan, startup recovery resumes it.
     */
    RUNNING,

    /**
     * A plan was saved.
     */
    COMPLETED,

    /**
     * Plan generation failed.
     */
    ERROR;

    public boolean isInterrupted(TaskPlan plan) {
        return this == RUNNING && plan == null;
    }
}

package com.taskfactory.core.model;

/**
 * Lifecycle status of an agent session.
 */
public enum SessionStatus {
    /**
     * Waiting for the next conversational turn.
     * Accepts: follow-up
     */
    IDLE,

    /**
     * Agent is working on a turn.
     * Accepts: steer
     */
    RUNNING,

    /**
     * Stopped on request. The registry entry is gone once stop returns.
     */
    PAUSED,

    /**
     * Collaborator reported success.
     */
    COMPLETED,

    /**
     * Collaborator reported failure.
     */
    ERROR;

    /**
     * Check if a session in this status still occupies the task's single slot.
     */
    public boolean isLive() {
        return this == IDLE || this == RUNNING;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}

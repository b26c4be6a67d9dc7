package com.taskfactory.agent;

/**
 * Status notification posted back by the agent runner for one of its sessions.
 *
 * Types: running, idle, completed, failed
 */
public record AgentCallback(
    String type,
    String errorMessage,
    String summary
) {
    public static final String RUNNING = "running";
    public static final String IDLE = "idle";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
}

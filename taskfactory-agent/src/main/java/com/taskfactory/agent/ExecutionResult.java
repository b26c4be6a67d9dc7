package com.taskfactory.agent;

/**
 * Final outcome of a session as reported by the collaborator.
 */
public record ExecutionResult(
    boolean success,
    String errorMessage,
    String summary
) {
    public static ExecutionResult succeeded(String summary) {
        return new ExecutionResult(true, null, summary);
    }

    public static ExecutionResult failed(String errorMessage) {
        return new ExecutionResult(false, errorMessage != null ? errorMessage : "unknown error", null);
    }
}

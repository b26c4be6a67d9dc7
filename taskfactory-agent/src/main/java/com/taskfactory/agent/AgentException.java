package com.taskfactory.agent;

/**
 * Exception thrown by agent collaborators when a session cannot be opened or driven.
 */
public class AgentException extends Exception {

    public static final String UNAVAILABLE = "AGENT_UNAVAILABLE";
    public static final String REJECTED = "AGENT_REJECTED";
    public static final String PROTOCOL = "AGENT_PROTOCOL";

    private final String errorCode;
    private final boolean retryable;

    public AgentException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = true;
    }

    public AgentException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public AgentException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = true;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (the runner refused the request).
     */
    public static AgentException rejected(String message) {
        return new AgentException(REJECTED, message, false);
    }
}

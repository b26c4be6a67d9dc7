package com.taskfactory.core.exception;

/**
 * Thrown at the API edge when a steer or stop targets a task without a live session.
 */
public class SessionNotFoundException extends TaskFactoryException {

    public static final String ERROR_CODE = "SESSION_NOT_FOUND";

    public SessionNotFoundException(String taskId) {
        super(ERROR_CODE, String.format("No active agent session for task %s", taskId));
    }

    public SessionNotFoundException(String taskId, String detail) {
        super(ERROR_CODE, String.format("No active agent session for task %s: %s", taskId, detail));
    }
}

package com.taskfactory.core.exception;

/**
 * Thrown when a session is started for a task that already has a live one.
 */
public class AlreadyRunningException extends TaskFactoryException {

    public static final String ERROR_CODE = "ALREADY_RUNNING";

    public AlreadyRunningException(String taskId) {
        super(ERROR_CODE, String.format("Task %s already has a live agent session", taskId));
    }
}

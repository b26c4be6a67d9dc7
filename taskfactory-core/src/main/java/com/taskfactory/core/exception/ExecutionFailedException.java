package com.taskfactory.core.exception;

/**
 * Thrown when the execution collaborator could not open or drive a session.
 */
public class ExecutionFailedException extends TaskFactoryException {

    public static final String ERROR_CODE = "EXECUTION_FAILED";

    public ExecutionFailedException(String taskId, String message) {
        super(ERROR_CODE, String.format("Execution failed for task %s: %s", taskId, message));
    }

    public ExecutionFailedException(String taskId, String message, Throwable cause) {
        super(ERROR_CODE, String.format("Execution failed for task %s: %s", taskId, message), cause);
    }
}

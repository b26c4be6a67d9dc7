package com.taskfactory.core.exception;

import com.taskfactory.core.model.Phase;

/**
 * Thrown when a structural precondition for a phase change or reorder is not met.
 */
public class InvalidTransitionException extends TaskFactoryException {

    public static final String ERROR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String taskId, Phase from, Phase to, String reason) {
        super(ERROR_CODE, String.format(
            "Cannot move task %s from %s to %s: %s",
            taskId, from, to, reason
        ));
    }

    public InvalidTransitionException(String message) {
        super(ERROR_CODE, message);
    }
}

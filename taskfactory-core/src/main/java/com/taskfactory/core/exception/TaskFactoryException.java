package com.taskfactory.core.exception;

/**
 * Base exception for all task factory errors.
 */
public class TaskFactoryException extends RuntimeException {

    private final String errorCode;

    public TaskFactoryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskFactoryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

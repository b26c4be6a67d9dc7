package com.taskfactory.core.exception;

/**
 * Thrown at the API edge when a Q&A request is unknown or already resolved.
 */
public class RequestNotFoundException extends TaskFactoryException {

    public static final String ERROR_CODE = "REQUEST_NOT_FOUND";

    public RequestNotFoundException(String requestId) {
        super(ERROR_CODE, String.format("No pending Q&A request found: %s", requestId));
    }
}

package com.taskfactory.core.exception;

/**
 * Thrown when a requested entity is not found.
 */
public class NotFoundException extends TaskFactoryException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String id) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, id));
    }
}

package com.taskfactory.core.exception;

import java.util.List;

/**
 * Thrown when WIP limits or automation settings are malformed.
 */
public class ConfigurationValidationException extends TaskFactoryException {

    public static final String ERROR_CODE = "INVALID_CONFIGURATION";

    private final List<String> errors;

    public ConfigurationValidationException(List<String> errors) {
        super(ERROR_CODE, "Invalid configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

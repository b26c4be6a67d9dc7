package com.taskfactory.api.rest;

import java.util.Map;

/**
 * Body of every error response.
 */
public record ErrorResponse(
    String errorCode,
    String message,
    Map<String, Object> details
) {
    public ErrorResponse {
        details = details != null ? details : Map.of();
    }

    public static ErrorResponse of(String errorCode, String message) {
        return new ErrorResponse(errorCode, message, Map.of());
    }
}

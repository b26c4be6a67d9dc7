package com.taskfactory.api.rest;

import com.taskfactory.core.exception.AlreadyRunningException;
import com.taskfactory.core.exception.CapacityExceededException;
import com.taskfactory.core.exception.ConfigurationValidationException;
import com.taskfactory.core.exception.ExecutionFailedException;
import com.taskfactory.core.exception.InvalidTransitionException;
import com.taskfactory.core.exception.NotFoundException;
import com.taskfactory.core.exception.RequestNotFoundException;
import com.taskfactory.core.exception.SessionNotFoundException;
import com.taskfactory.core.exception.TaskFactoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps task factory exceptions to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacity(CapacityExceededException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("phase", e.getPhase());
        details.put("limit", e.getLimit());
        details.put("current", e.getCurrent());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), details));
    }

    @ExceptionHandler(ConfigurationValidationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationValidationException e) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), Map.of("errors", e.getErrors())));
    }

    @ExceptionHandler(TaskFactoryException.class)
    public ResponseEntity<ErrorResponse> handleTaskFactory(TaskFactoryException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.warn("Request failed: {}", e.getMessage());
        } else {
            log.debug("Request rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
            .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(VALIDATION_FAILED, "Request validation failed", details));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        Throwable cause = e.getCause() instanceof IllegalArgumentException ? e.getCause() : e;
        return ResponseEntity.badRequest().body(ErrorResponse.of(VALIDATION_FAILED, cause.getMessage()));
    }

    private static HttpStatus statusFor(TaskFactoryException e) {
        if (e instanceof InvalidTransitionException || e instanceof ConfigurationValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof AlreadyRunningException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof SessionNotFoundException
                || e instanceof RequestNotFoundException
                || e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ExecutionFailedException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}

package com.wpanther.fpolifecycle.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wpanther.fpolifecycle.entity.FpoStatus;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    @ExceptionHandler(LifecycleException.class)
    public ResponseEntity<ErrorResponse> handleLifecycleException(LifecycleException ex) {
        if (ex.getHttpStatus().is5xxServerError()) {
            log.error("Lifecycle operation failed: code={}, currentStatus={}", ex.getErrorCode(), ex.getCurrentStatus(), ex);
        } else {
            log.warn("Lifecycle operation rejected: code={}, currentStatus={}, message={}",
                    ex.getErrorCode(), ex.getCurrentStatus(), ex.getMessage());
        }
        ErrorResponse errorResponse = new ErrorResponse(
            ex.getMessage(),
            ex.getHttpStatus().value(),
            Instant.now(),
            ex.getErrorCode(),
            ex.getCurrentStatus()
        );
        return new ResponseEntity<>(errorResponse, ex.getHttpStatus());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.BAD_REQUEST, "BAD_REQUEST");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return createErrorResponse("Malformed request body", HttpStatus.BAD_REQUEST, "BAD_REQUEST");
    }

    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(Exception ex) {
        return createErrorResponse(ex.getMessage(), HttpStatus.NOT_FOUND, "NOT_FOUND");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return createErrorResponse(ex.getMessage(), HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        log.warn("Validation error: {}", ex.getMessage());

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ValidationErrorResponse errorResponse = new ValidationErrorResponse(
            "Validation failed",
            HttpStatus.BAD_REQUEST.value(),
            Instant.now(),
            errors
        );

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex) {
        log.error("Unexpected error", ex);
        return createErrorResponse("An unexpected error occurred: " + ex.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR");
    }

    private ResponseEntity<ErrorResponse> createErrorResponse(String message, HttpStatus status, String code) {
        ErrorResponse errorResponse = new ErrorResponse(
            message,
            status.value(),
            Instant.now(),
            code,
            null
        );
        return new ResponseEntity<>(errorResponse, status);
    }

    // Error response classes
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        private final String message;
        private final int status;
        private final Instant timestamp;
        private final String code;
        private final FpoStatus currentStatus;

        public ErrorResponse(String message, int status, Instant timestamp, String code, FpoStatus currentStatus) {
            this.message = message;
            this.status = status;
            this.timestamp = timestamp;
            this.code = code;
            this.currentStatus = currentStatus;
        }

        public String getMessage() {
            return message;
        }

        public int getStatus() {
            return status;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public String getCode() {
            return code;
        }

        public FpoStatus getCurrentStatus() {
            return currentStatus;
        }
    }

    public static class ValidationErrorResponse extends ErrorResponse {
        private final Map<String, String> errors;

        public ValidationErrorResponse(String message, int status, Instant timestamp, Map<String, String> errors) {
            super(message, status, timestamp, "VALIDATION_FAILED", null);
            this.errors = errors;
        }

        public Map<String, String> getErrors() {
            return errors;
        }
    }
}

package com.wpanther.fpolifecycle.exception;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import org.springframework.http.HttpStatus;

/**
 * The access-control service failed in a way that is neither a timeout nor a rejection.
 */
public class ExternalServiceException extends LifecycleException {

    public ExternalServiceException(String message) {
        this(message, null);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super("EXTERNAL_SERVICE_ERROR", HttpStatus.BAD_GATEWAY, message, null, cause);
    }

    protected ExternalServiceException(String errorCode, HttpStatus httpStatus, String message,
                                       FpoStatus currentStatus, Throwable cause) {
        super(errorCode, httpStatus, message, currentStatus, cause);
    }
}

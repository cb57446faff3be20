package com.wpanther.fpolifecycle.exception;

import org.springframework.http.HttpStatus;

/**
 * External failures worth another attempt. Only these are retried by the call executor.
 */
public abstract class TransientExternalException extends ExternalServiceException {

    protected TransientExternalException(String errorCode, HttpStatus httpStatus, String message, Throwable cause) {
        super(errorCode, httpStatus, message, null, cause);
    }
}

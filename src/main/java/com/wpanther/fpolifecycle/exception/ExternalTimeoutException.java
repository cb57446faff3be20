package com.wpanther.fpolifecycle.exception;

import org.springframework.http.HttpStatus;

public class ExternalTimeoutException extends TransientExternalException {

    public ExternalTimeoutException(String message) {
        this(message, null);
    }

    public ExternalTimeoutException(String message, Throwable cause) {
        super("EXTERNAL_TIMEOUT", HttpStatus.GATEWAY_TIMEOUT, message, cause);
    }
}

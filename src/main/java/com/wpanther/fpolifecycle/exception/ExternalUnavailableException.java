package com.wpanther.fpolifecycle.exception;

import org.springframework.http.HttpStatus;

public class ExternalUnavailableException extends TransientExternalException {

    public ExternalUnavailableException(String message, Throwable cause) {
        super("EXTERNAL_UNAVAILABLE", HttpStatus.BAD_GATEWAY, message, cause);
    }
}

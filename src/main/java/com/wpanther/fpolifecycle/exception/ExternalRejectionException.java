package com.wpanther.fpolifecycle.exception;

import org.springframework.http.HttpStatus;

/**
 * The access-control service refused the request (bad input, duplicate). Never retried.
 */
public class ExternalRejectionException extends ExternalServiceException {

    private final int responseStatus;

    public ExternalRejectionException(String message, int responseStatus) {
        super("EXTERNAL_REJECTED", HttpStatus.BAD_GATEWAY, message, null, null);
        this.responseStatus = responseStatus;
    }

    public int getResponseStatus() {
        return responseStatus;
    }
}

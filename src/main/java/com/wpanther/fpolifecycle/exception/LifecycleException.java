package com.wpanther.fpolifecycle.exception;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import org.springframework.http.HttpStatus;

/**
 * Base type for every failed lifecycle operation.
 * Carries a stable error code for clients and the organization's status at the time of failure,
 * which is always the status it still has.
 */
public abstract class LifecycleException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus httpStatus;
    private FpoStatus currentStatus;

    protected LifecycleException(String errorCode, HttpStatus httpStatus, String message,
                                 FpoStatus currentStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.currentStatus = currentStatus;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public FpoStatus getCurrentStatus() {
        return currentStatus;
    }

    /**
     * Exceptions raised below the lifecycle service do not know the record; the service fills it in.
     */
    public LifecycleException attachCurrentStatus(FpoStatus status) {
        if (this.currentStatus == null) {
            this.currentStatus = status;
        }
        return this;
    }
}

package com.wpanther.fpolifecycle.exception;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import org.springframework.http.HttpStatus;

public class TransitionCancelledException extends LifecycleException {

    public TransitionCancelledException(String message, FpoStatus currentStatus, Throwable cause) {
        super("CANCELLED", HttpStatus.SERVICE_UNAVAILABLE, message, currentStatus, cause);
    }
}

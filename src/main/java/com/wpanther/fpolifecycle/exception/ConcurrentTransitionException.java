package com.wpanther.fpolifecycle.exception;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import org.springframework.http.HttpStatus;

/**
 * The record changed between read and write; the caller should re-read and decide again.
 */
public class ConcurrentTransitionException extends LifecycleException {

    public ConcurrentTransitionException(String organizationId, FpoStatus currentStatus, Throwable cause) {
        super("CONCURRENT_MODIFICATION", HttpStatus.CONFLICT,
                "FPO " + organizationId + " was modified concurrently", currentStatus, cause);
    }
}

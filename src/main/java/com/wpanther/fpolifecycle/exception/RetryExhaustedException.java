package com.wpanther.fpolifecycle.exception;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import org.springframework.http.HttpStatus;

public class RetryExhaustedException extends LifecycleException {

    public RetryExhaustedException(String organizationId, int attempts, int maxAttempts, FpoStatus currentStatus) {
        super("RETRY_EXHAUSTED", HttpStatus.CONFLICT,
                "Setup retries exhausted for FPO " + organizationId + " (" + attempts + "/" + maxAttempts + ")",
                currentStatus, null);
    }
}

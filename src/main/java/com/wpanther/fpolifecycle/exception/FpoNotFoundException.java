package com.wpanther.fpolifecycle.exception;

import org.springframework.http.HttpStatus;

public class FpoNotFoundException extends LifecycleException {

    public FpoNotFoundException(String organizationId) {
        super("FPO_NOT_FOUND", HttpStatus.NOT_FOUND, "FPO not found: " + organizationId, null, null);
    }
}

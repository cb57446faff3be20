package com.wpanther.fpolifecycle.exception;

import org.springframework.http.HttpStatus;

public class DuplicateRegistrationException extends LifecycleException {

    public DuplicateRegistrationException(String registrationNumber) {
        super("DUPLICATE_REGISTRATION", HttpStatus.CONFLICT,
                "An FPO with registration number " + registrationNumber + " already exists", null, null);
    }
}

package com.wpanther.fpolifecycle.service;

import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import com.wpanther.fpolifecycle.entity.SetupStep;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of one provisioning run. A failed run is a normal outcome, not an error.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SetupOutcome {

    private final boolean succeeded;
    private final OrganizationRecord record;
    private final SetupStep failedStep;
    private final String errorCode;
    private final String cause;

    public static SetupOutcome succeeded(OrganizationRecord record) {
        return new SetupOutcome(true, record, null, null, null);
    }

    public static SetupOutcome failed(OrganizationRecord record, SetupStep step, String errorCode, String cause) {
        return new SetupOutcome(false, record, step, errorCode, cause);
    }
}

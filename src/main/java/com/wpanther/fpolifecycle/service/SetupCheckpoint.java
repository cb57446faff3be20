package com.wpanther.fpolifecycle.service;

import com.wpanther.fpolifecycle.entity.OrganizationRecord;

/**
 * Persists provisioning bookkeeping between setup steps.
 * Implementations must return the saved instance, which carries the new version.
 */
@FunctionalInterface
public interface SetupCheckpoint {

    OrganizationRecord save(OrganizationRecord record);
}

package com.wpanther.fpolifecycle.entity;

/**
 * Lifecycle states of an FPO record.
 * ARCHIVED is the only terminal state.
 */
public enum FpoStatus {
    DRAFT,
    PENDING_VERIFICATION,
    VERIFIED,
    REJECTED,
    PENDING_SETUP,
    SETUP_FAILED,
    ACTIVE,
    SUSPENDED,
    INACTIVE,
    ARCHIVED;

    public boolean isTerminal() {
        return this == ARCHIVED;
    }
}

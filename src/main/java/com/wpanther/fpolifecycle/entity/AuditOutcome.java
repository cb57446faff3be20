package com.wpanther.fpolifecycle.entity;

public enum AuditOutcome {
    SUCCESS,
    FAILED
}

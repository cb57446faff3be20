package com.wpanther.fpolifecycle.entity;

public enum VerificationStatus {
    PENDING,
    VERIFIED,
    REJECTED
}

package com.pushit.entity;

public enum ConnectionVerificationStatus {
    PENDING,
    VERIFIED,
    REJECTED,
    FAILED
}

package com.pushit.entity;

public enum BrandVerificationStatus {
    PENDING,
    VERIFIED,
    REJECTED,
    REQUEST_INFO,
    PAUSED
}

package com.pushit.entity;

public enum InfluencerVerificationStatus {
    PENDING,
    APPROVED,
    REJECTED,
    REQUEST_INFO,
    PAUSED
}

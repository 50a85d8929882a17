package com.pushit.entity;

public enum NotificationType {
    SUBMISSION_VERIFIED,
    SUBMISSION_FLAGGED,
    PAYOUT_SENT,
    PAYOUT_AVAILABLE,
    ACCOUNT_VERIFIED,
    PLATFORM_VERIFIED,
    GENERAL
}

package com.pushit.entity;

public enum PayoutStatus {
    PENDING,
    SENT,
    FAILED
}

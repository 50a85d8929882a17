package com.pushit.entity;

public enum WithdrawalStatus {
    PENDING,
    PROCESSED,
    REJECTED
}

package com.pushit.entity;

public enum TransactionStatus {
    PENDING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public boolean isFinal() {
        return this != PENDING;
    }
}

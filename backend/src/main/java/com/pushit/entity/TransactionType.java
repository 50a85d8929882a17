package com.pushit.entity;

public enum TransactionType {
    WALLET_TOPUP,
    CAMPAIGN_PAYMENT
}

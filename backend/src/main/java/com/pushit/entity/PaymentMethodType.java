package com.pushit.entity;

public enum PaymentMethodType {
    BANK,
    MOBILE_MONEY
}

package com.pushit.entity;

public enum MobileMoneyNetwork {
    MTN,
    VODAFONE,
    AIRTELTIGO
}

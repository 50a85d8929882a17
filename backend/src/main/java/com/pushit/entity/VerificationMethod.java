package com.pushit.entity;

public enum VerificationMethod {
    AUTO,
    MANUAL
}

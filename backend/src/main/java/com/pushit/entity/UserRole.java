package com.pushit.entity;

public enum UserRole {
    BRAND,
    INFLUENCER,
    ADMIN
}

package com.pushit.entity;

public enum QueueSubjectType {
    BRAND,
    INFLUENCER
}

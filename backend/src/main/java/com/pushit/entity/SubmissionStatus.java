package com.pushit.entity;

public enum SubmissionStatus {
    NEW,
    IN_REVIEW,
    VERIFIED,
    FLAGGED,
    NEEDS_REUPLOAD
}

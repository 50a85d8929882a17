package com.pushit.service.job;

import com.pushit.entity.SubmissionStatus;
import java.util.Locale;

/** Admin decision on a proof-of-work submission. */
public enum ReviewAction {
    APPROVE(SubmissionStatus.VERIFIED),
    REJECT(SubmissionStatus.NEEDS_REUPLOAD),
    FLAG(SubmissionStatus.FLAGGED);

    private final SubmissionStatus resultingStatus;

    ReviewAction(SubmissionStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public SubmissionStatus resultingStatus() {
        return resultingStatus;
    }

    public static ReviewAction parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Review action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown review action: " + value, e);
        }
    }
}

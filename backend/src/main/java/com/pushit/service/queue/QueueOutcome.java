package com.pushit.service.queue;

import java.util.Locale;

/** What happened to the subject of a drained queue entry. */
public enum QueueOutcome {
    APPROVED,
    PENDING,
    SKIPPED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.pushit.service.verification;

/** Counts from one batch pass over pending platform connections. */
public record BatchVerificationStats(
        int totalProcessed, int autoApproved, int flagged, int rejected) {}

package com.pushit.service.verification;

import com.pushit.service.follower.FollowerCheckResult;
import java.util.List;

/**
 * Aggregate outcome of a verification run.
 *
 * @param passed whether the subject can be approved automatically
 * @param reason short human-readable summary
 * @param confidence aggregate score in [0, 1]
 * @param flags warnings collected from every check
 * @param hardFail a blocking rule was violated, so the subject cannot pass whatever the confidence
 * @param followerCheck follower cross-check outcome, null for brands
 */
public record VerificationResult(
        boolean passed,
        String reason,
        double confidence,
        List<String> flags,
        boolean hardFail,
        FollowerCheckResult followerCheck) {

    public VerificationResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        flags = List.copyOf(flags);
    }

    public static VerificationResult manualReview(String reason) {
        return new VerificationResult(
                false, reason, 0.0, List.of("Requires manual review"), false, null);
    }
}

package com.pushit.service.follower;

/**
 * Outcome of comparing a declared follower count with the platform's count.
 *
 * @param verified the fetched count is within tolerance of the declared one
 * @param actualCount fetched count, null when every source failed
 * @param declaredCount count the influencer declared
 * @param discrepancy absolute difference, 0 when nothing was fetched
 * @param method source of {@code actualCount}
 * @param error why nothing was fetched, null otherwise
 */
public record FollowerCheckResult(
        boolean verified,
        Long actualCount,
        long declaredCount,
        long discrepancy,
        FetchMethod method,
        String error) {

    public static FollowerCheckResult unverifiable(long declaredCount, String error) {
        return new FollowerCheckResult(false, null, declaredCount, 0, FetchMethod.MANUAL, error);
    }

    public boolean hasActualCount() {
        return actualCount != null;
    }

    /** Difference as a percentage of the fetched count, 0 when that count is 0 or unknown. */
    public double discrepancyPercent() {
        if (actualCount == null || actualCount == 0) {
            return 0.0;
        }
        return discrepancy * 100.0 / actualCount;
    }
}

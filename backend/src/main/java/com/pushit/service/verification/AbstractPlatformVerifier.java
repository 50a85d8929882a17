package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.entity.PlatformConnection;
import com.pushit.service.follower.FollowerCheckResult;
import com.pushit.service.follower.FollowerCountCrossChecker;
import com.pushit.service.follower.FollowerCredentials;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared checks for every platform: follower cross-check, minimum followers (a hard fail), handle
 * format and the optional sample post URL. Subclasses add platform checks and may override the
 * decision.
 */
public abstract class AbstractPlatformVerifier implements PlatformVerifier {

    private static final Pattern DEFAULT_HANDLE = Pattern.compile("^[a-zA-Z0-9._]+$");

    protected final FollowerCountCrossChecker crossChecker;
    protected final AppProperties.Verification settings;

    protected AbstractPlatformVerifier(
            FollowerCountCrossChecker crossChecker, AppProperties appProperties) {
        this.crossChecker = crossChecker;
        this.settings = appProperties.verification();
    }

    @Override
    public VerificationResult verify(PlatformConnection connection, long minimumFollowers) {
        CheckTally tally = new CheckTally();

        FollowerCheckResult followerCheck =
                crossChecker.check(
                        platform(),
                        connection.getHandle(),
                        connection.getFollowersCount(),
                        FollowerCredentials.of(connection));
        scoreFollowerCheck(connection, followerCheck, tally);

        long countToCheck = countForMinimum(connection, followerCheck);
        boolean belowMinimum =
                !tally.check(
                        countToCheck >= minimumFollowers,
                        belowMinimumFlag(countToCheck, minimumFollowers));

        boolean handleValid =
                tally.check(isHandleValid(connection.getHandle()), invalidHandleFlag());

        String sampleUrl = connection.getSamplePostUrl();
        if (sampleUrl != null && !sampleUrl.isBlank()) {
            tally.check(
                    matchesPlatformHost(sampleUrl),
                    "Sample post URL doesn't appear to be from " + platform().getDisplayName());
        }

        addPlatformChecks(connection, tally);

        return decide(
                new Outcome(
                        tally,
                        followerCheck,
                        belowMinimum,
                        handleValid,
                        countToCheck,
                        minimumFollowers));
    }

    /** Hook for platform-specific checks. */
    protected void addPlatformChecks(PlatformConnection connection, CheckTally tally) {}

    protected void scoreFollowerCheck(
            PlatformConnection connection, FollowerCheckResult result, CheckTally tally) {
        if (result.verified() && result.hasActualCount() && result.actualCount() > 0) {
            tally.check(true, null);
        } else if (result.hasActualCount()) {
            tally.check(
                    false,
                    String.format(
                            Locale.US,
                            "Follower count mismatch: User provided %,d, API shows %,d"
                                    + " (difference: %,d, %.1f%%)",
                            connection.getFollowersCount(),
                            result.actualCount(),
                            result.discrepancy(),
                            result.discrepancyPercent()));
        } else {
            tally.check(false, "Unable to verify follower count via API - requires manual review");
        }
    }

    protected String belowMinimumFlag(long count, long minimum) {
        return String.format(Locale.US, "Follower count (%,d) below minimum (%,d)", count, minimum);
    }

    protected String invalidHandleFlag() {
        return "Invalid handle format";
    }

    protected Pattern handlePattern() {
        return DEFAULT_HANDLE;
    }

    /** Lower-case host fragments a sample post URL must contain. */
    protected abstract String[] sampleUrlHosts();

    /** Generic rule: confidence at or above the platform threshold and no hard fail. */
    protected VerificationResult decide(Outcome outcome) {
        CheckTally tally = outcome.tally();
        double confidence = tally.confidence();
        boolean passed = confidence >= settings.platformPassThreshold() && !outcome.belowMinimum();
        return new VerificationResult(
                passed,
                tally.summary(),
                confidence,
                tally.flags(),
                outcome.belowMinimum(),
                outcome.followerCheck());
    }

    protected final boolean isHandleValid(String handle) {
        return handle != null && !handle.isEmpty() && handlePattern().matcher(handle).matches();
    }

    private boolean matchesPlatformHost(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        for (String host : sampleUrlHosts()) {
            if (lower.contains(host)) {
                return true;
            }
        }
        return false;
    }

    /** The fetched count when there is one, otherwise the connection's effective count. */
    private long countForMinimum(PlatformConnection connection, FollowerCheckResult result) {
        if (result.hasActualCount() && result.actualCount() > 0) {
            return result.actualCount();
        }
        return connection.getEffectiveFollowers();
    }

    /** Everything the decision step needs from the checks that ran. */
    protected record Outcome(
            CheckTally tally,
            FollowerCheckResult followerCheck,
            boolean belowMinimum,
            boolean handleValid,
            long countChecked,
            long minimumFollowers) {}
}

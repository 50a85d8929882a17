package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.entity.Platform;
import com.pushit.entity.PlatformConnection;
import com.pushit.service.follower.FollowerCheckResult;
import com.pushit.service.follower.FollowerCountCrossChecker;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * YouTube subscriber counts come from a public API, so a wrong declared count is corrected rather
 * than held against the channel: the minimum is checked on the real count, and a channel the API
 * confirms above the minimum passes.
 */
@Component
public class YouTubeVerifier extends AbstractPlatformVerifier {

    private static final Pattern CHANNEL_HANDLE = Pattern.compile("^[a-zA-Z0-9._-]+$");

    static final double API_UNAVAILABLE_CONFIDENCE = 0.7;
    static final double API_CONFIRMED_CONFIDENCE = 0.9;

    public YouTubeVerifier(FollowerCountCrossChecker crossChecker, AppProperties appProperties) {
        super(crossChecker, appProperties);
    }

    @Override
    public Platform platform() {
        return Platform.YOUTUBE;
    }

    @Override
    protected String[] sampleUrlHosts() {
        return new String[] {"youtube.com", "youtu.be"};
    }

    @Override
    protected Pattern handlePattern() {
        return CHANNEL_HANDLE;
    }

    @Override
    protected String invalidHandleFlag() {
        return "Invalid channel handle format";
    }

    @Override
    protected String belowMinimumFlag(long count, long minimum) {
        return String.format(
                Locale.US,
                "Your channel has %,d subscribers, but you need at least %,d to join."
                        + " Please grow your channel and try again.",
                count,
                minimum);
    }

    @Override
    protected void scoreFollowerCheck(
            PlatformConnection connection, FollowerCheckResult result, CheckTally tally) {
        if (!result.hasActualCount()) {
            tally.check(false, "Unable to verify subscriber count via API - using provided count");
            return;
        }
        tally.check(
                result.verified(),
                String.format(
                        Locale.US,
                        "Follower count corrected: Your channel has %,d subscribers"
                                + " (you provided %,d)",
                        result.actualCount(),
                        connection.getFollowersCount()));
    }

    @Override
    protected VerificationResult decide(Outcome outcome) {
        CheckTally tally = outcome.tally();
        boolean apiUnavailable = !outcome.followerCheck().hasActualCount();

        if (outcome.belowMinimum()) {
            return result(false, tally.confidence(), outcome);
        }
        if (apiUnavailable) {
            if (outcome.handleValid()) {
                return result(true, API_UNAVAILABLE_CONFIDENCE, outcome);
            }
            double confidence = tally.confidence();
            return result(confidence >= settings.platformPassThreshold(), confidence, outcome);
        }
        if (outcome.followerCheck().actualCount() >= outcome.minimumFollowers()
                && outcome.handleValid()) {
            return result(true, API_CONFIRMED_CONFIDENCE, outcome);
        }
        return super.decide(outcome);
    }

    private VerificationResult result(boolean passed, double confidence, Outcome outcome) {
        CheckTally tally = outcome.tally();
        String reason = tally.summary();
        if (outcome.followerCheck().hasActualCount()) {
            reason +=
                    String.format(
                            Locale.US,
                            " (Real count: %,d)",
                            outcome.followerCheck().actualCount());
        }
        return new VerificationResult(
                passed,
                reason,
                confidence,
                tally.flags(),
                outcome.belowMinimum(),
                outcome.followerCheck());
    }
}

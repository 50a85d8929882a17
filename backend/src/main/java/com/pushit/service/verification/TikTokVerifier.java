package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.entity.Platform;
import com.pushit.entity.PlatformConnection;
import com.pushit.service.follower.FollowerCountCrossChecker;
import org.springframework.stereotype.Component;

@Component
public class TikTokVerifier extends AbstractPlatformVerifier {

    public TikTokVerifier(FollowerCountCrossChecker crossChecker, AppProperties appProperties) {
        super(crossChecker, appProperties);
    }

    @Override
    public Platform platform() {
        return Platform.TIKTOK;
    }

    @Override
    protected String[] sampleUrlHosts() {
        return new String[] {"tiktok.com"};
    }

    @Override
    protected void addPlatformChecks(PlatformConnection connection, CheckTally tally) {
        tally.check(
                connection.getFollowersCount() < settings.maxReasonableFollowers(),
                "Very high follower count - manual review recommended");

        double engagement = connection.getEngagementRate();
        if (engagement > 0) {
            tally.check(
                    engagement >= 0.5 && engagement <= 10,
                    "Unusual engagement rate: " + engagement + "%");
        }
    }
}

package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.entity.Platform;
import com.pushit.entity.PlatformConnection;
import com.pushit.service.follower.FollowerCountCrossChecker;
import org.springframework.stereotype.Component;

@Component
public class InstagramVerifier extends AbstractPlatformVerifier {

    public InstagramVerifier(FollowerCountCrossChecker crossChecker, AppProperties appProperties) {
        super(crossChecker, appProperties);
    }

    @Override
    public Platform platform() {
        return Platform.INSTAGRAM;
    }

    @Override
    protected String[] sampleUrlHosts() {
        return new String[] {"instagram.com"};
    }

    @Override
    protected void addPlatformChecks(PlatformConnection connection, CheckTally tally) {
        double engagement = connection.getEngagementRate();
        if (engagement > 0) {
            tally.check(
                    engagement >= 0.5 && engagement <= 8,
                    "Unusual engagement rate: " + engagement + "%");
        }
    }
}

package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.entity.Platform;
import com.pushit.service.follower.FollowerCountCrossChecker;
import org.springframework.stereotype.Component;

/** Facebook pages only get the shared checks. */
@Component
public class FacebookVerifier extends AbstractPlatformVerifier {

    public FacebookVerifier(FollowerCountCrossChecker crossChecker, AppProperties appProperties) {
        super(crossChecker, appProperties);
    }

    @Override
    public Platform platform() {
        return Platform.FACEBOOK;
    }

    @Override
    protected String[] sampleUrlHosts() {
        return new String[] {"facebook.com"};
    }
}

package com.pushit.service.verification;

import com.pushit.entity.Platform;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Closed mapping from {@link Platform} to its verifier. The switch is exhaustive, so adding a
 * platform without a verifier fails to compile.
 */
@Component
public class PlatformVerifierRegistry {

    private final Map<Platform, PlatformVerifier> verifiers = new EnumMap<>(Platform.class);

    public PlatformVerifierRegistry(
            TikTokVerifier tikTok,
            InstagramVerifier instagram,
            YouTubeVerifier youTube,
            FacebookVerifier facebook) {
        for (Platform platform : Platform.values()) {
            PlatformVerifier verifier =
                    switch (platform) {
                        case TIKTOK -> tikTok;
                        case INSTAGRAM -> instagram;
                        case YOUTUBE -> youTube;
                        case FACEBOOK -> facebook;
                    };
            verifiers.put(platform, verifier);
        }
    }

    public PlatformVerifier forPlatform(Platform platform) {
        return verifiers.get(platform);
    }
}

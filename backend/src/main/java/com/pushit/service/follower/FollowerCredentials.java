package com.pushit.service.follower;

import com.pushit.entity.PlatformConnection;

/**
 * Connection-scoped credentials for the follower lookup.
 *
 * @param accessToken OAuth token granted by the influencer, may be null
 * @param platformAccountId TikTok open id, Instagram business account id or Facebook page id, may
 *     be null
 */
public record FollowerCredentials(String accessToken, String platformAccountId) {

    public static FollowerCredentials none() {
        return new FollowerCredentials(null, null);
    }

    public static FollowerCredentials of(PlatformConnection connection) {
        return new FollowerCredentials(
                connection.getAccessToken(), connection.getPlatformAccountId());
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    public boolean hasAccountId() {
        return platformAccountId != null && !platformAccountId.isBlank();
    }
}

package com.pushit.service.follower;

import com.pushit.client.PlatformApiClient;
import com.pushit.client.ProfilePageScraper;
import com.pushit.client.RapidApiClient;
import com.pushit.config.AppProperties;
import com.pushit.entity.Platform;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fetches a live follower count and reconciles it with the declared one. Sources are tried in a
 * fixed order per platform (official API, then the RapidAPI proxy, then the public page) until one
 * yields a count. Holds no state and writes nothing.
 */
@Slf4j
@Service
public class FollowerCountCrossChecker {

    private final PlatformApiClient platformApiClient;
    private final RapidApiClient rapidApiClient;
    private final ProfilePageScraper profilePageScraper;
    private final AppProperties.Integrations integrations;
    private final AppProperties.Verification verification;

    public FollowerCountCrossChecker(
            PlatformApiClient platformApiClient,
            RapidApiClient rapidApiClient,
            ProfilePageScraper profilePageScraper,
            AppProperties appProperties) {
        this.platformApiClient = platformApiClient;
        this.rapidApiClient = rapidApiClient;
        this.profilePageScraper = profilePageScraper;
        this.integrations = appProperties.integrations();
        this.verification = appProperties.verification();
    }

    public FollowerCheckResult check(
            Platform platform, String handle, long declaredCount, FollowerCredentials credentials) {
        String cleanHandle = stripAt(handle);
        List<Source> sources = sourcesFor(platform, cleanHandle, credentials);
        if (sources.isEmpty()) {
            log.warn(
                    "No follower source configured for {} @{}, flagging for manual review",
                    platform,
                    cleanHandle);
            return FollowerCheckResult.unverifiable(
                    declaredCount,
                    "No follower count source configured for " + platform.getDisplayName());
        }

        for (Source source : sources) {
            try {
                OptionalLong count = source.fetch().get();
                if (count.isPresent()) {
                    log.info(
                            "Fetched {} followers for {} @{} via {}",
                            count.getAsLong(),
                            platform,
                            cleanHandle,
                            source.name());
                    return compare(platform, declaredCount, count.getAsLong(), source.method());
                }
                log.debug("{} returned no count for {} @{}", source.name(), platform, cleanHandle);
            } catch (RuntimeException e) {
                log.warn(
                        "{} failed for {} @{}: {}",
                        source.name(),
                        platform,
                        cleanHandle,
                        e.getMessage());
            }
        }

        return FollowerCheckResult.unverifiable(
                declaredCount, "Unable to fetch follower count automatically");
    }

    /** max(floor, declared x ratio); YouTube uses its own floor. */
    public double allowedDiscrepancy(Platform platform, long declaredCount) {
        long floor =
                platform == Platform.YOUTUBE
                        ? verification.youtubeToleranceFloor()
                        : verification.toleranceFloor();
        return Math.max(floor, declaredCount * verification.toleranceRatio());
    }

    FollowerCheckResult compare(
            Platform platform, long declaredCount, long actualCount, FetchMethod method) {
        long discrepancy = Math.abs(actualCount - declaredCount);
        boolean verified = discrepancy <= allowedDiscrepancy(platform, declaredCount);
        return new FollowerCheckResult(
                verified, actualCount, declaredCount, discrepancy, method, null);
    }

    private List<Source> sourcesFor(
            Platform platform, String handle, FollowerCredentials credentials) {
        List<Source> sources = new ArrayList<>();
        switch (platform) {
            case TIKTOK -> {
                if (credentials.hasAccessToken()) {
                    sources.add(
                            new Source(
                                    "TikTok OAuth user info",
                                    FetchMethod.API,
                                    () ->
                                            platformApiClient.fetchTikTokFollowersWithToken(
                                                    credentials.accessToken())));
                }
                if (isSet(integrations.tiktokApiKey()) && credentials.hasAccountId()) {
                    sources.add(
                            new Source(
                                    "TikTok research API",
                                    FetchMethod.API,
                                    () ->
                                            platformApiClient.fetchTikTokFollowersWithApiKey(
                                                    integrations.tiktokApiKey(),
                                                    credentials.platformAccountId())));
                }
            }
            case INSTAGRAM -> {
                String token =
                        credentials.hasAccessToken()
                                ? credentials.accessToken()
                                : integrations.instagramAccessToken();
                if (isSet(token)) {
                    sources.add(
                            new Source(
                                    "Instagram Graph API",
                                    FetchMethod.API,
                                    () -> fetchInstagramViaGraph(handle, credentials, token)));
                }
                if (isSet(integrations.rapidApiKey())) {
                    sources.add(
                            new Source(
                                    "RapidAPI Instagram",
                                    FetchMethod.PROXY,
                                    () ->
                                            rapidApiClient.fetchInstagramFollowers(
                                                    handle, integrations.rapidApiKey())));
                }
                sources.add(
                        new Source(
                                "Instagram page scrape",
                                FetchMethod.SCRAPE,
                                () -> profilePageScraper.scrapeInstagram(handle)));
            }
            case FACEBOOK -> {
                String token =
                        credentials.hasAccessToken()
                                ? credentials.accessToken()
                                : integrations.facebookAccessToken();
                if (isSet(token)) {
                    sources.add(
                            new Source(
                                    "Facebook Graph API",
                                    FetchMethod.API,
                                    () -> fetchFacebookViaGraph(handle, credentials, token)));
                }
                if (isSet(integrations.rapidApiKey())) {
                    sources.add(
                            new Source(
                                    "RapidAPI Facebook",
                                    FetchMethod.PROXY,
                                    () ->
                                            rapidApiClient.fetchFacebookFollowers(
                                                    handle, integrations.rapidApiKey())));
                }
                sources.add(
                        new Source(
                                "Facebook page scrape",
                                FetchMethod.SCRAPE,
                                () -> profilePageScraper.scrapeFacebook(handle)));
            }
            case YOUTUBE -> {
                if (isSet(integrations.youtubeApiKey())) {
                    sources.add(
                            new Source(
                                    "YouTube Data API",
                                    FetchMethod.API,
                                    () ->
                                            platformApiClient.fetchYouTubeSubscribers(
                                                    handle, integrations.youtubeApiKey())));
                }
            }
        }
        return sources;
    }

    private OptionalLong fetchInstagramViaGraph(
            String handle, FollowerCredentials credentials, String token) {
        Optional<String> accountId =
                credentials.hasAccountId()
                        ? Optional.of(credentials.platformAccountId())
                        : platformApiClient.findInstagramAccountId(handle, token);
        if (accountId.isEmpty()) {
            log.debug("No Instagram business account found for @{}", handle);
            return OptionalLong.empty();
        }
        return platformApiClient.fetchInstagramFollowers(accountId.get(), token);
    }

    private OptionalLong fetchFacebookViaGraph(
            String handle, FollowerCredentials credentials, String token) {
        String pageId =
                credentials.hasAccountId()
                        ? credentials.platformAccountId()
                        : platformApiClient.searchFacebookPageId(handle, token).orElse(handle);
        return platformApiClient.fetchFacebookFollowers(pageId, token);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static String stripAt(String handle) {
        String trimmed = handle == null ? "" : handle.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    }

    private record Source(String name, FetchMethod method, Supplier<OptionalLong> fetch) {}
}

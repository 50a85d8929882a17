package com.pushit.service.follower;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.pushit.client.PlatformApiClient;
import com.pushit.client.ProfilePageScraper;
import com.pushit.client.RapidApiClient;
import com.pushit.config.AppProperties;
import com.pushit.entity.Platform;
import java.time.Duration;
import java.util.OptionalLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FollowerCountCrossCheckerTest {

    @Mock private PlatformApiClient platformApiClient;

    @Mock private RapidApiClient rapidApiClient;

    @Mock private ProfilePageScraper profilePageScraper;

    private FollowerCountCrossChecker crossChecker;

    @BeforeEach
    void setUp() {
        AppProperties.Integrations integrations =
                new AppProperties.Integrations(
                        "yt-key",
                        null,
                        null,
                        null,
                        "rapid-key",
                        "https://www.googleapis.com/youtube/v3",
                        "https://graph.facebook.com",
                        "v18.0",
                        "https://open.tiktokapis.com/v2",
                        Duration.ofSeconds(10),
                        Duration.ofSeconds(15));
        AppProperties properties =
                new AppProperties(
                        AppProperties.Verification.defaults(),
                        integrations,
                        AppProperties.Paystack.defaults(),
                        AppProperties.Wallet.defaults(),
                        AppProperties.Email.defaults());
        crossChecker =
                new FollowerCountCrossChecker(
                        platformApiClient, rapidApiClient, profilePageScraper, properties);
    }

    @Test
    void tiktokWithinFivePercent_IsVerified() {
        when(platformApiClient.fetchTikTokFollowersWithToken("token"))
                .thenReturn(OptionalLong.of(10_300));

        FollowerCheckResult result =
                crossChecker.check(
                        Platform.TIKTOK, "@ama", 10_000, new FollowerCredentials("token", null));

        assertTrue(result.verified());
        assertEquals(10_300L, result.actualCount());
        assertEquals(300, result.discrepancy());
        assertEquals(FetchMethod.API, result.method());
    }

    @Test
    void smallAccountsUseTheAbsoluteFloor() {
        when(platformApiClient.fetchTikTokFollowersWithToken("token"))
                .thenReturn(OptionalLong.of(1_600));

        FollowerCheckResult result =
                crossChecker.check(
                        Platform.TIKTOK, "ama", 1_500, new FollowerCredentials("token", null));

        // 5% of 1,500 is 75, so the floor of 100 applies
        assertTrue(result.verified());
        assertEquals(100.0, crossChecker.allowedDiscrepancy(Platform.TIKTOK, 1_500));
    }

    @Test
    void discrepancyBeyondTolerance_IsNotVerified() {
        when(platformApiClient.fetchTikTokFollowersWithToken("token"))
                .thenReturn(OptionalLong.of(8_000));

        FollowerCheckResult result =
                crossChecker.check(
                        Platform.TIKTOK, "ama", 10_000, new FollowerCredentials("token", null));

        assertFalse(result.verified());
        assertEquals(2_000, result.discrepancy());
    }

    @Test
    void youtubeUsesItsOwnFloor() {
        assertEquals(50.0, crossChecker.allowedDiscrepancy(Platform.YOUTUBE, 500));
        assertEquals(500.0, crossChecker.allowedDiscrepancy(Platform.YOUTUBE, 10_000));
    }

    @Test
    void instagramFallsThroughToProxyWhenGraphIsNotConfigured() {
        when(rapidApiClient.fetchInstagramFollowers("ama", "rapid-key"))
                .thenReturn(OptionalLong.of(5_050));

        FollowerCheckResult result =
                crossChecker.check(Platform.INSTAGRAM, "@ama", 5_000, FollowerCredentials.none());

        assertTrue(result.verified());
        assertEquals(FetchMethod.PROXY, result.method());
        verify(profilePageScraper, never()).scrapeInstagram(anyString());
    }

    @Test
    void failingSourceIsSkippedAndScrapeIsTried() {
        when(rapidApiClient.fetchFacebookFollowers(anyString(), anyString()))
                .thenThrow(new IllegalStateException("proxy down"));
        when(profilePageScraper.scrapeFacebook("kofifoods")).thenReturn(OptionalLong.of(2_000));

        FollowerCheckResult result =
                crossChecker.check(
                        Platform.FACEBOOK, "kofifoods", 2_050, FollowerCredentials.none());

        assertTrue(result.verified());
        assertEquals(FetchMethod.SCRAPE, result.method());
    }

    @Test
    void everySourceFailing_IsUnverifiableForManualReview() {
        when(rapidApiClient.fetchInstagramFollowers(anyString(), anyString()))
                .thenReturn(OptionalLong.empty());
        when(profilePageScraper.scrapeInstagram(anyString()))
                .thenThrow(new IllegalStateException("blocked"));

        FollowerCheckResult result =
                crossChecker.check(Platform.INSTAGRAM, "ama", 5_000, FollowerCredentials.none());

        assertFalse(result.verified());
        assertNull(result.actualCount());
        assertEquals(FetchMethod.MANUAL, result.method());
        assertNotNull(result.error());
    }

    @Test
    void tiktokWithoutTokenOrKey_HasNoSource() {
        FollowerCheckResult result =
                crossChecker.check(Platform.TIKTOK, "ama", 5_000, FollowerCredentials.none());

        assertFalse(result.hasActualCount());
        assertTrue(result.error().contains("TikTok"));
        verifyNoInteractions(platformApiClient);
    }
}

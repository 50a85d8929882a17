package com.pushit.service.verification;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.pushit.config.AppProperties;
import com.pushit.entity.Platform;
import com.pushit.entity.PlatformConnection;
import com.pushit.service.follower.FetchMethod;
import com.pushit.service.follower.FollowerCheckResult;
import com.pushit.service.follower.FollowerCountCrossChecker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PlatformVerifierTest {

    private static final long MINIMUM = 1_000;

    @Mock private FollowerCountCrossChecker crossChecker;

    private PlatformVerifierRegistry registry;

    @BeforeEach
    void setUp() {
        AppProperties properties = AppProperties.defaults();
        registry =
                new PlatformVerifierRegistry(
                        new TikTokVerifier(crossChecker, properties),
                        new InstagramVerifier(crossChecker, properties),
                        new YouTubeVerifier(crossChecker, properties),
                        new FacebookVerifier(crossChecker, properties));
    }

    private void crossCheckReturns(Platform platform, long declared, Long actual) {
        FollowerCheckResult result =
                actual == null
                        ? FollowerCheckResult.unverifiable(declared, "unavailable")
                        : new FollowerCheckResult(
                                Math.abs(actual - declared)
                                        <= Math.max(
                                                platform == Platform.YOUTUBE ? 50 : 100,
                                                declared * 0.05),
                                actual,
                                declared,
                                Math.abs(actual - declared),
                                FetchMethod.API,
                                null);
        when(crossChecker.check(eq(platform), anyString(), eq(declared), any()))
                .thenReturn(result);
    }

    private PlatformConnection connection(Platform platform, String handle, long followers) {
        return PlatformConnection.builder()
                .platform(platform)
                .handle(handle)
                .followersCount(followers)
                .build();
    }

    @Test
    void registryCoversEveryPlatform() {
        for (Platform platform : Platform.values()) {
            assertEquals(platform, registry.forPlatform(platform).platform());
        }
    }

    @Test
    void tiktokDeclared10kWithApi10300_PassesWithFullConfidence() {
        crossCheckReturns(Platform.TIKTOK, 10_000, 10_300L);

        VerificationResult result =
                registry.forPlatform(Platform.TIKTOK)
                        .verify(connection(Platform.TIKTOK, "ama_gh", 10_000), MINIMUM);

        assertTrue(result.passed());
        assertTrue(result.followerCheck().verified());
        assertEquals(1.0, result.confidence());
        assertFalse(result.hardFail());
    }

    @Test
    void tiktokUnusualEngagement_LowersConfidenceBelowThreshold() {
        crossCheckReturns(Platform.TIKTOK, 10_000, 10_000L);
        PlatformConnection connection = connection(Platform.TIKTOK, "ama_gh", 10_000);
        connection.setEngagementRate(25.0);
        connection.setSamplePostUrl("https://example.com/video/1");

        VerificationResult result =
                registry.forPlatform(Platform.TIKTOK).verify(connection, MINIMUM);

        // followers, minimum, handle pass; sample URL and engagement fail; declared < 1M passes
        assertEquals(4.0 / 6.0, result.confidence(), 1e-9);
        assertFalse(result.passed());
        assertTrue(result.flags().contains("Unusual engagement rate: 25.0%"));
    }

    @Test
    void youtubeDeclared500BelowMinimum_HardFailsWithoutApi() {
        crossCheckReturns(Platform.YOUTUBE, 500, null);

        VerificationResult result =
                registry.forPlatform(Platform.YOUTUBE)
                        .verify(connection(Platform.YOUTUBE, "kwame-vlogs", 500), MINIMUM);

        assertFalse(result.passed());
        assertTrue(result.hardFail());
    }

    @Test
    void youtubeDeclared500BelowMinimum_HardFailsWithApi() {
        crossCheckReturns(Platform.YOUTUBE, 500, 520L);

        VerificationResult result =
                registry.forPlatform(Platform.YOUTUBE)
                        .verify(connection(Platform.YOUTUBE, "kwame-vlogs", 500), MINIMUM);

        assertFalse(result.passed());
        assertTrue(result.hardFail());
    }

    @Test
    void youtubeApiUnavailableWithValidHandle_PassesAtReducedConfidence() {
        crossCheckReturns(Platform.YOUTUBE, 5_000, null);

        VerificationResult result =
                registry.forPlatform(Platform.YOUTUBE)
                        .verify(connection(Platform.YOUTUBE, "kwame-vlogs", 5_000), MINIMUM);

        assertTrue(result.passed());
        assertEquals(YouTubeVerifier.API_UNAVAILABLE_CONFIDENCE, result.confidence());
    }

    @Test
    void youtubeApiCorrectsDeclaredCount_PassesWhenRealCountMeetsMinimum() {
        crossCheckReturns(Platform.YOUTUBE, 2_000, 5_000L);

        VerificationResult result =
                registry.forPlatform(Platform.YOUTUBE)
                        .verify(connection(Platform.YOUTUBE, "kwame-vlogs", 2_000), MINIMUM);

        assertTrue(result.passed());
        assertEquals(YouTubeVerifier.API_CONFIRMED_CONFIDENCE, result.confidence());
        assertTrue(result.flags().get(0).startsWith("Follower count corrected"));
    }

    @Test
    void instagramInvalidHandleAndMismatch_IsNotPassed() {
        crossCheckReturns(Platform.INSTAGRAM, 50_000, 20_000L);

        VerificationResult result =
                registry.forPlatform(Platform.INSTAGRAM)
                        .verify(connection(Platform.INSTAGRAM, "bad handle!", 50_000), MINIMUM);

        assertFalse(result.passed());
        assertFalse(result.hardFail());
        assertTrue(result.flags().contains("Invalid handle format"));
        assertTrue(result.flags().get(0).startsWith("Follower count mismatch"));
    }

    @Test
    void unverifiableCountStillChecksMinimumOnDeclaredCount() {
        crossCheckReturns(Platform.FACEBOOK, 800, null);

        VerificationResult result =
                registry.forPlatform(Platform.FACEBOOK)
                        .verify(connection(Platform.FACEBOOK, "kofifoods", 800), MINIMUM);

        assertTrue(result.hardFail());
        assertFalse(result.passed());
    }
}

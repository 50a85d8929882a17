package com.pushit.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Application configuration, bound once at startup from the {@code app.*} namespace and injected
 * into the components that need it.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
        @Valid @DefaultValue Verification verification,
        @Valid @DefaultValue Integrations integrations,
        @Valid @DefaultValue Paystack paystack,
        @Valid @DefaultValue Wallet wallet,
        @Valid @DefaultValue Email email) {

    public static AppProperties defaults() {
        return new AppProperties(
                Verification.defaults(),
                Integrations.defaults(),
                Paystack.defaults(),
                Wallet.defaults(),
                Email.defaults());
    }

    /** Scoring thresholds, cross-check tolerance and queue timing. */
    public record Verification(
            @DefaultValue("true") boolean autoApprove,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.7") double brandPassThreshold,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.8")
                    double platformPassThreshold,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.5") double rejectBelow,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.05") double toleranceRatio,
            @Min(0) @DefaultValue("100") long toleranceFloor,
            @Min(0) @DefaultValue("50") long youtubeToleranceFloor,
            @Min(0) @DefaultValue("1000") long defaultMinimumFollowers,
            @Min(1) @DefaultValue("1000000") long maxReasonableFollowers,
            @Min(0) @DefaultValue("5") int queueDelayMinMinutes,
            @Min(0) @DefaultValue("10") int queueDelayMaxMinutes,
            @Min(1) @DefaultValue("50") int drainBatchSize,
            @Min(1) @DefaultValue("15") int claimLeaseMinutes,
            @Min(1000) @DefaultValue("90000") long drainIntervalMs,
            @Min(1) @DefaultValue("100") int batchLimit) {

        public static Verification defaults() {
            return new Verification(
                    true, 0.7, 0.8, 0.5, 0.05, 100, 50, 1000, 1_000_000, 5, 10, 50, 15, 90_000,
                    100);
        }
    }

    /** Credentials and timeouts for the follower-count sources. */
    public record Integrations(
            String youtubeApiKey,
            String tiktokApiKey,
            String instagramAccessToken,
            String facebookAccessToken,
            String rapidApiKey,
            @DefaultValue("https://www.googleapis.com/youtube/v3") String youtubeBaseUrl,
            @DefaultValue("https://graph.facebook.com") String graphBaseUrl,
            @DefaultValue("v18.0") String graphApiVersion,
            @DefaultValue("https://open.tiktokapis.com/v2") String tiktokBaseUrl,
            @DefaultValue("10s") Duration apiTimeout,
            @DefaultValue("15s") Duration scrapeTimeout) {

        public static Integrations defaults() {
            return new Integrations(
                    null,
                    null,
                    null,
                    null,
                    null,
                    "https://www.googleapis.com/youtube/v3",
                    "https://graph.facebook.com",
                    "v18.0",
                    "https://open.tiktokapis.com/v2",
                    Duration.ofSeconds(10),
                    Duration.ofSeconds(15));
        }
    }

    public record Paystack(
            String secretKey,
            String publicKey,
            @NotBlank @DefaultValue("https://api.paystack.co") String baseUrl,
            @DefaultValue("http://localhost:8080/api/v1/payments/paystack/callback")
                    String callbackUrl) {

        public static Paystack defaults() {
            return new Paystack(
                    null,
                    null,
                    "https://api.paystack.co",
                    "http://localhost:8080/api/v1/payments/paystack/callback");
        }
    }

    public record Wallet(
            @NotBlank @DefaultValue("GHS") String fallbackCurrencyCode,
            @DefaultValue("50") BigDecimal minimumWithdrawal,
            @Min(1) @DefaultValue("30") int payoutDueDays) {

        public static Wallet defaults() {
            return new Wallet("GHS", new BigDecimal("50"), 30);
        }
    }

    public record Email(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("noreply@pushit.app") String from,
            @DefaultValue("http://localhost:8080/api/v1/auth/verify-email")
                    String verificationBaseUrl,
            @DefaultValue("change-me-change-me-change-me-change-me-0123456789")
                    String tokenSecret,
            @DefaultValue("24h") Duration tokenTtl,
            @DefaultValue("pushit") String tokenIssuer) {

        public static Email defaults() {
            return new Email(
                    false,
                    "noreply@pushit.app",
                    "http://localhost:8080/api/v1/auth/verify-email",
                    "change-me-change-me-change-me-change-me-0123456789",
                    Duration.ofHours(24),
                    "pushit");
        }
    }
}

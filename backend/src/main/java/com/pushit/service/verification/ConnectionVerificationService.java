package com.pushit.service.verification;

import com.pushit.config.AppProperties;
import com.pushit.dto.request.PlatformConnectionRequest;
import com.pushit.entity.ConnectionVerificationStatus;
import com.pushit.entity.Influencer;
import com.pushit.entity.InfluencerVerificationStatus;
import com.pushit.entity.NotificationType;
import com.pushit.entity.PlatformConnection;
import com.pushit.entity.VerificationMethod;
import com.pushit.exception.ApiException;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.monitoring.VerificationMetrics;
import com.pushit.repository.InfluencerRepository;
import com.pushit.repository.PlatformConnectionRepository;
import com.pushit.service.follower.FollowerCheckResult;
import com.pushit.service.notification.NotificationService;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs platform verifiers against stored connections and applies the outcome: auto-approve, leave
 * pending for manual review, or reject.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionVerificationService {

    private static final long SUSPICIOUS_FOLLOWER_THRESHOLD = 1_000_000;
    private static final double SUSPICIOUS_LOW_ENGAGEMENT = 0.5;
    private static final double SUSPICIOUS_ENGAGEMENT_FLOOR = 0.1;

    private final PlatformConnectionRepository connectionRepository;
    private final InfluencerRepository influencerRepository;
    private final PlatformVerifierRegistry verifierRegistry;
    private final PlatformSettingsService platformSettingsService;
    private final NotificationService notificationService;
    private final VerificationMetrics verificationMetrics;
    private final AppProperties appProperties;

    /**
     * Creates the connection and verifies it straight away. Verification is an explicit step here,
     * never a side effect of saving.
     */
    @Transactional
    public PlatformConnection connectPlatform(
            Influencer influencer, PlatformConnectionRequest request) {
        if (connectionRepository.existsByInfluencerIdAndPlatform(
                influencer.getId(), request.getPlatform())) {
            throw new ApiException(
                    request.getPlatform().getDisplayName() + " is already connected",
                    HttpStatus.CONFLICT,
                    "PLATFORM_ALREADY_CONNECTED");
        }

        PlatformConnection connection =
                PlatformConnection.builder()
                        .influencer(influencer)
                        .platform(request.getPlatform())
                        .handle(request.getHandle().trim())
                        .followersCount(request.getFollowersCount())
                        .engagementRate(request.getEngagementRate())
                        .averageViews(request.getAverageViews())
                        .samplePostUrl(request.getSamplePostUrl())
                        .accessToken(request.getAccessToken())
                        .platformAccountId(request.getPlatformAccountId())
                        .build();
        connection = connectionRepository.save(connection);
        log.info(
                "Influencer {} connected {} as {}",
                influencer.getId(),
                connection.getPlatform(),
                connection.getHandle());

        verifyConnection(connection);
        return connection;
    }

    /** Verifies one connection and stores the outcome on it. */
    @Transactional
    public VerificationResult verifyConnection(PlatformConnection connection) {
        VerificationResult result = runVerifier(connection);
        applyFollowerCheck(connection, result.followerCheck());

        connection.setVerificationConfidence(result.confidence());
        connection.setVerificationFlags(new ArrayList<>(result.flags()));
        connection.setVerificationMethod(VerificationMethod.AUTO);

        String outcome;
        if (result.passed()) {
            connection.setVerificationStatus(ConnectionVerificationStatus.VERIFIED);
            connection.setVerifiedAt(LocalDateTime.now());
            outcome = "approved";
        } else if (result.confidence() < appProperties.verification().rejectBelow()) {
            connection.setVerificationStatus(ConnectionVerificationStatus.REJECTED);
            outcome = "rejected";
        } else {
            connection.setVerificationStatus(ConnectionVerificationStatus.PENDING);
            outcome = "pending";
        }
        connectionRepository.save(connection);
        verificationMetrics.recordOutcome("connection", outcome);

        log.info(
                "Connection {} ({} {}) verified: {} with confidence {} [{}]",
                connection.getId(),
                connection.getPlatform(),
                connection.getHandle(),
                outcome,
                String.format("%.2f", result.confidence()),
                result.reason());

        if (result.passed()) {
            notificationService.notify(
                    connection.getInfluencer().getUser(),
                    NotificationType.PLATFORM_VERIFIED,
                    connection.getPlatform().getDisplayName() + " verified",
                    "Your "
                            + connection.getPlatform().getDisplayName()
                            + " account @"
                            + connection.getHandle()
                            + " has been verified.");
        }
        return result;
    }

    /** Verifies every pending connection of the influencer. */
    @Transactional
    public Map<Long, VerificationResult> verifyInfluencerPlatforms(Influencer influencer) {
        Map<Long, VerificationResult> results = new LinkedHashMap<>();
        for (PlatformConnection connection :
                connectionRepository.findByInfluencerIdAndVerificationStatus(
                        influencer.getId(), ConnectionVerificationStatus.PENDING)) {
            results.put(connection.getId(), verifyConnection(connection));
        }
        return results;
    }

    /** Oldest pending connections first. */
    @Transactional
    public BatchVerificationStats batchVerifyPending(int limit) {
        List<PlatformConnection> pending =
                connectionRepository.findByStatusOldestFirst(
                        ConnectionVerificationStatus.PENDING, PageRequest.of(0, limit));

        int autoApproved = 0;
        int flagged = 0;
        int rejected = 0;
        for (PlatformConnection connection : pending) {
            VerificationResult result = verifyConnection(connection);
            if (result.passed()) {
                autoApproved++;
            } else if (connection.getVerificationStatus()
                    == ConnectionVerificationStatus.REJECTED) {
                rejected++;
            } else {
                flagged++;
            }
        }

        BatchVerificationStats stats =
                new BatchVerificationStats(pending.size(), autoApproved, flagged, rejected);
        log.info("Batch verification finished: {}", stats);
        return stats;
    }

    /** Verified connections whose audience and engagement do not fit together. */
    @Transactional(readOnly = true)
    public List<PlatformConnection> flagSuspiciousConnections() {
        Map<Long, PlatformConnection> suspicious = new LinkedHashMap<>();
        connectionRepository
                .findHighReachLowEngagement(
                        SUSPICIOUS_FOLLOWER_THRESHOLD, SUSPICIOUS_LOW_ENGAGEMENT)
                .forEach(c -> suspicious.put(c.getId(), c));
        connectionRepository
                .findVerifiedWithEngagementBelow(SUSPICIOUS_ENGAGEMENT_FLOOR)
                .forEach(c -> suspicious.putIfAbsent(c.getId(), c));
        return List.copyOf(suspicious.values());
    }

    /** Admin decision on a connection. */
    @Transactional
    public PlatformConnection reviewConnection(Long connectionId, boolean approve, String notes) {
        PlatformConnection connection =
                connectionRepository
                        .findById(connectionId)
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "PlatformConnection", connectionId));

        connection.setVerificationMethod(VerificationMethod.MANUAL);
        if (approve) {
            connection.setVerificationStatus(ConnectionVerificationStatus.VERIFIED);
            connection.setVerifiedAt(LocalDateTime.now());
        } else {
            connection.setVerificationStatus(ConnectionVerificationStatus.REJECTED);
        }
        if (notes != null && !notes.isBlank()) {
            List<String> flags = new ArrayList<>(connection.getVerificationFlags());
            flags.add("Admin: " + notes.trim());
            connection.setVerificationFlags(flags);
        }
        PlatformConnection saved = connectionRepository.save(connection);
        log.info("Connection {} manually {}", connectionId, approve ? "verified" : "rejected");

        if (approve) {
            notificationService.notify(
                    connection.getInfluencer().getUser(),
                    NotificationType.PLATFORM_VERIFIED,
                    connection.getPlatform().getDisplayName() + " verified",
                    "Your "
                            + connection.getPlatform().getDisplayName()
                            + " account has been verified by our team.");
        }
        return saved;
    }

    /**
     * Approves a pending influencer once they have a verified connection that meets its platform
     * minimum and a complete profile.
     *
     * @return true when the influencer was approved by this call
     */
    @Transactional
    public boolean autoApproveInfluencer(Influencer influencer) {
        if (influencer.getVerificationStatus() != InfluencerVerificationStatus.PENDING) {
            return false;
        }
        List<PlatformConnection> verified =
                connectionRepository.findByInfluencerIdAndVerificationStatus(
                        influencer.getId(), ConnectionVerificationStatus.VERIFIED);
        if (verified.isEmpty()) {
            log.debug("Influencer {} has no verified connection yet", influencer.getId());
            return false;
        }

        boolean meetsMinimum =
                verified.stream()
                        .anyMatch(
                                c ->
                                        effectiveFollowers(c)
                                                >= platformSettingsService.minimumFollowers(
                                                        c.getPlatform()));
        boolean hasNiche = influencer.getNiche() != null && !influencer.getNiche().isBlank();
        boolean hasPrimaryPlatform = influencer.getPrimaryPlatform() != null;

        if (!meetsMinimum || !hasNiche || !hasPrimaryPlatform) {
            log.info(
                    "Influencer {} left pending: minimum {}, niche {}, primary platform {}",
                    influencer.getId(),
                    meetsMinimum,
                    hasNiche,
                    hasPrimaryPlatform);
            return false;
        }

        influencer.setVerificationStatus(InfluencerVerificationStatus.APPROVED);
        influencerRepository.save(influencer);
        verificationMetrics.recordOutcome("influencer", "approved");
        log.info("Influencer {} auto-approved", influencer.getId());

        notificationService.notify(
                influencer.getUser(),
                NotificationType.ACCOUNT_VERIFIED,
                "Account approved",
                "Your influencer account has been approved. You can now accept campaigns.");
        return true;
    }

    @Transactional(readOnly = true)
    public List<PlatformConnection> listConnections(Long influencerId) {
        return connectionRepository.findByInfluencerId(influencerId);
    }

    /** Verified count when one has been fetched, otherwise the declared count. */
    public static long effectiveFollowers(PlatformConnection connection) {
        Long verified = connection.getVerifiedFollowersCount();
        return verified != null && verified > 0 ? verified : connection.getFollowersCount();
    }

    private VerificationResult runVerifier(PlatformConnection connection) {
        if (!platformSettingsService.isActive(connection.getPlatform())) {
            return VerificationResult.manualReview(
                    connection.getPlatform().getDisplayName()
                            + " is not verified automatically");
        }
        PlatformVerifier verifier = verifierRegistry.forPlatform(connection.getPlatform());
        if (verifier == null) {
            return VerificationResult.manualReview(
                    "No verifier for " + connection.getPlatform().getDisplayName());
        }
        return verifier.verify(
                connection, platformSettingsService.minimumFollowers(connection.getPlatform()));
    }

    private void applyFollowerCheck(PlatformConnection connection, FollowerCheckResult check) {
        if (check != null && check.hasActualCount()) {
            connection.setVerifiedFollowersCount(check.actualCount());
            connection.setFollowerVerificationDate(LocalDateTime.now());
        }
    }
}
